package com.vsensor.tracker.support;

import com.vsensor.core.error.SensorNotFoundException;
import com.vsensor.core.model.SensorInfo;
import com.vsensor.tracker.repo.ISensorInfoRepository;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class StubSensorInfoRepository implements ISensorInfoRepository {
    private final Map<String, SensorInfo> sensors = new ConcurrentHashMap<>();
    private volatile boolean failing;

    public StubSensorInfoRepository with(String sensorId, SensorInfo info) {
        sensors.put(sensorId, info);
        return this;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public Mono<SensorInfo> lookup(String sensorId) {
        return Mono.defer(() -> {
            if (failing) {
                return Mono.error(new IllegalStateException("database locked"));
            }
            SensorInfo info = sensors.get(sensorId);
            return info != null ? Mono.just(info) : Mono.error(new SensorNotFoundException(sensorId));
        });
    }

    @Override
    public void close() {
    }
}
