package com.vsensor.tracker.repo;

import com.vsensor.core.model.SensorInfo;
import reactor.core.publisher.Mono;

/**
 * Read-only lookup of descriptive sensor metadata.
 */
public interface ISensorInfoRepository extends AutoCloseable {

    /**
     * @param sensorId sensor identifier
     * @return the metadata, or an error of {@link com.vsensor.core.error.SensorNotFoundException}
     * when the sensor is unknown
     */
    Mono<SensorInfo> lookup(String sensorId);

    @Override
    void close();
}
