package com.vsensor.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Validated heartbeat published by a virtual sensor.
 * <p>
 * Only produced by {@link com.vsensor.core.msg.HeartbeatParser}; holding one means the
 * identity fields are present and well-typed.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class Heartbeat {
    /**
     * Sensor identifier.
     */
    String id;

    /**
     * Display name reported by the sensor.
     */
    String name;

    /**
     * Cluster the sensor belongs to.
     */
    String cluster;

    /**
     * Configuration object, or {@code null} when the heartbeat carries none.
     */
    JsonNode config;

    /**
     * Set when the sensor announces it is going away.
     */
    boolean departing;

    /**
     * Metadata derived from the heartbeat alone, used when the repository has nothing better.
     */
    public SensorInfo toSensorInfo() {
        return SensorInfo.builder()
            .name(name)
            .cluster(cluster)
            .build();
    }
}
