package com.vsensor.simulator.publish;

import reactor.core.publisher.Mono;

/**
 * Publishes heartbeat payloads to the heartbeat channel.
 */
public interface IHeartbeatPublisher extends AutoCloseable {

    Mono<Void> publish(String sensorId, String payload);

    @Override
    void close();
}
