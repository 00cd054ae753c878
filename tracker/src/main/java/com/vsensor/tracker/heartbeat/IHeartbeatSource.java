package com.vsensor.tracker.heartbeat;

import reactor.core.publisher.Flux;

/**
 * Source of raw heartbeat payloads from the shared heartbeat channel.
 */
public interface IHeartbeatSource extends AutoCloseable {

    /**
     * Raw payloads in arrival order. The flux reconnects on transient channel errors and
     * completes only when the source is closed.
     */
    Flux<String> heartbeats();

    @Override
    void close();
}
