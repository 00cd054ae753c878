package com.vsensor.core.msg;

import java.util.Locale;

/**
 * Publish/subscribe transport carrying heartbeats.
 */
public enum HeartbeatTransport {
    /**
     * Redis pub/sub channel.
     */
    REDIS,

    /**
     * Kafka topic, keyed by sensor id.
     */
    KAFKA;

    public static HeartbeatTransport fromString(String value) {
        try {
            return HeartbeatTransport.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown heartbeat transport '" + value + "' (expected redis or kafka)", e);
        }
    }
}
