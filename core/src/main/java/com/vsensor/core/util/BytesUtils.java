package com.vsensor.core.util;

import java.nio.charset.StandardCharsets;

public final class BytesUtils {
    private BytesUtils() {
    }

    /**
     * @return size of {@code str} on the wire (UTF-8), 0 for null
     */
    public static long utf8Length(String str) {
        return str == null ? 0 : str.getBytes(StandardCharsets.UTF_8).length;
    }
}
