package com.vsensor.core.redis;

/**
 * Redis keyspace used by the tracker.
 */
public final class Keys {
    private Keys() {
    }

    /**
     * State cache hash: {@code virtual-sensor-tracking}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b> sensor id → JSON-serialized {@code SensorState}
     * <br>
     * <b>TTL:</b> none; sensors are never deleted, a dead sensor keeps its last state.
     * </p>
     */
    public static final String STATE_CACHE = "virtual-sensor-tracking";
}
