package com.vsensor.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Static descriptive metadata of a sensor, owned by the metadata repository.
 * <p>
 * Heartbeats never carry the description; it is only known once the repository
 * has a row for the sensor.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class SensorInfo {
    @JsonProperty("name")
    String name;

    @JsonProperty("cluster")
    String cluster;

    @JsonProperty("description")
    String description;

    @JsonCreator
    public SensorInfo(
        @JsonProperty("name") String name,
        @JsonProperty("cluster") String cluster,
        @JsonProperty("description") String description
    ) {
        this.name = name;
        this.cluster = cluster;
        this.description = description;
    }
}
