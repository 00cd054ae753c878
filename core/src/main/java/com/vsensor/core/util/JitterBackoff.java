package com.vsensor.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff for resubscribing to a broken heartbeat channel.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * </p>
 * <p>
 * Several tracker nodes lose the broker at the same moment when it restarts; the jitter
 * spreads their reconnects.
 * </p>
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    private static final Duration DEFAULT_BASE = Duration.ofMillis(500);
    private static final Duration DEFAULT_MAX = Duration.ofSeconds(30);
    private static final Duration DEFAULT_JITTER = Duration.ofSeconds(1);

    /**
     * Computes the next backoff delay with jitter.
     *
     * @param attempt   retry attempt number (0-based)
     * @param base      base delay
     * @param max       cap applied before jitter
     * @param jitterMax maximum jitter to add
     * @return delay to wait before the next attempt
     */
    public static Duration next(long attempt, Duration base, Duration max, Duration jitterMax) {
        long exponent = Math.max(0, Math.min(attempt, 20));
        long expMs = base.toMillis() * (1L << exponent);
        long cappedMs = Math.min(expMs, max.toMillis());
        long jitterMs = ThreadLocalRandom.current().nextLong(jitterMax.toMillis() + 1);
        return Duration.ofMillis(cappedMs + jitterMs);
    }

    /**
     * Delay with the default channel reconnect parameters (base 500ms, max 30s, jitter 1s).
     *
     * @param attempt retry attempt number (0-based)
     * @return delay to wait before the next attempt
     */
    public static Duration next(long attempt) {
        return next(attempt, DEFAULT_BASE, DEFAULT_MAX, DEFAULT_JITTER);
    }
}
