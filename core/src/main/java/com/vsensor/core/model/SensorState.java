package com.vsensor.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.time.Instant;

/**
 * Latest known state of one sensor, as stored in the state cache and broadcast to observers.
 * <p>
 * <b>System-managed fields:</b> {@code id}, {@code active} and {@code lastUpdate} are only ever
 * set by the tracker. {@code config} is opaque and follows merge semantics: a write that
 * omits it keeps the previously stored value (see {@link SensorStates#merge}).
 * </p>
 * <p>
 * The metadata is serialized under {@code info} so the stored layout stays readable by the
 * existing dashboard.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SensorState {
    /**
     * Stable sensor identifier; the state cache field key.
     */
    @JsonProperty("id")
    String id;

    /**
     * Descriptive metadata resolved from the metadata repository (may be absent).
     */
    @JsonProperty("info")
    SensorInfo metadata;

    /**
     * True while heartbeats arrive within the dead timeout.
     */
    @JsonProperty("active")
    boolean active;

    /**
     * Instant of the most recent heartbeat or forced state change.
     */
    @JsonProperty("lastUpdate")
    Instant lastUpdate;

    /**
     * Opaque configuration payload; {@code null} when no heartbeat ever carried one.
     */
    @JsonProperty("config")
    JsonNode config;

    @JsonCreator
    public SensorState(
        @JsonProperty("id") String id,
        @JsonProperty("info") SensorInfo metadata,
        @JsonProperty("active") boolean active,
        @JsonProperty("lastUpdate") Instant lastUpdate,
        @JsonProperty("config") JsonNode config
    ) {
        this.id = id;
        this.metadata = metadata;
        this.active = active;
        this.lastUpdate = lastUpdate;
        // JSON null and a missing config are the same thing for merging
        this.config = config == null || config.isNull() || config.isMissingNode() ? null : config;
    }

    /**
     * Whether the sensor has been silent for strictly longer than {@code deadTimeout} at {@code now}.
     * A state without {@code lastUpdate} has never been refreshed and counts as expired.
     */
    @JsonIgnore
    public boolean isExpired(Instant now, Duration deadTimeout) {
        if (lastUpdate == null) {
            return true;
        }
        return Duration.between(lastUpdate, now).compareTo(deadTimeout) > 0;
    }
}
