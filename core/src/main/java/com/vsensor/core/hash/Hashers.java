package com.vsensor.core.hash;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Stable hash functions for spreading sensor ids over mutation lanes.
 * <p>
 * Murmur3 is non-cryptographic, fast and well distributed, which is all lane selection needs.
 * </p>
 */
public final class Hashers {
    private Hashers() {
    }

    /**
     * Computes the Murmur3 128-bit hash of a UTF-8 string.
     *
     * @param str input string
     * @return hash code
     */
    public static HashCode murmur3(String str) {
        return Hashing.murmur3_128().hashString(str, StandardCharsets.UTF_8);
    }

    /**
     * Maps a key onto one of {@code lanes} buckets.
     * <p>
     * The same key always maps to the same lane for a given lane count. Consistent hashing
     * keeps most keys in place if the lane count changes between restarts.
     * </p>
     *
     * @param key   sensor id
     * @param lanes number of lanes (at least 1)
     * @return lane index in {@code [0, lanes)}
     */
    public static int laneFor(String key, int lanes) {
        if (lanes < 1) {
            throw new IllegalArgumentException("lanes must be >= 1, got " + lanes);
        }
        return Hashing.consistentHash(murmur3(key), lanes);
    }
}
