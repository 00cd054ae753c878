package com.vsensor.core.error;

import lombok.Getter;

/**
 * The metadata repository has no entry for a sensor.
 */
@Getter
public class SensorNotFoundException extends RuntimeException {
    private final String sensorId;

    public SensorNotFoundException(String sensorId) {
        super("No metadata for sensor " + sensorId);
        this.sensorId = sensorId;
    }
}
