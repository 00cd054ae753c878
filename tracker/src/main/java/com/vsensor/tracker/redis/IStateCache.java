package com.vsensor.tracker.redis;

import com.vsensor.core.model.SensorState;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Shared keyed store of the latest {@link SensorState} per sensor.
 * <p>
 * Failures surface as {@link com.vsensor.core.error.StateCacheUnavailableException}.
 * </p>
 */
public interface IStateCache {

    /**
     * @return every stored record; unreadable entries are skipped
     */
    Flux<SensorState> getAll();

    /**
     * @param sensorId sensor identifier
     * @return the stored record, or empty if there is none
     */
    Mono<SensorState> getOne(String sensorId);

    /**
     * Merges {@code state} into the stored record and writes the result as one value.
     * A missing config in {@code state} keeps the stored config.
     *
     * @param state incoming state
     * @return the record that was written
     */
    Mono<SensorState> upsertMerge(SensorState state);
}
