package com.vsensor.tracker.support;

import com.vsensor.core.error.StateCacheUnavailableException;
import com.vsensor.core.model.SensorState;
import com.vsensor.core.model.SensorStates;
import com.vsensor.tracker.redis.IStateCache;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State cache backed by a map, with switches for simulating outages and slow writes.
 */
public class InMemoryStateCache implements IStateCache {
    private final Map<String, SensorState> store = new ConcurrentHashMap<>();
    private final Set<String> failingWrites = ConcurrentHashMap.newKeySet();
    private final AtomicInteger writes = new AtomicInteger();
    private volatile boolean available = true;
    private volatile Mono<Void> writeGate = Mono.empty();

    @Override
    public Flux<SensorState> getAll() {
        return Flux.defer(() -> available
            ? Flux.fromIterable(new ArrayList<>(store.values()))
            : Flux.error(outage()));
    }

    @Override
    public Mono<SensorState> getOne(String sensorId) {
        return Mono.defer(() -> available
            ? Mono.justOrEmpty(store.get(sensorId))
            : Mono.error(outage()));
    }

    @Override
    public Mono<SensorState> upsertMerge(SensorState state) {
        return Mono.defer(() -> {
            if (!available || failingWrites.contains(state.getId())) {
                return Mono.error(outage());
            }
            return writeGate.then(Mono.fromCallable(() -> {
                SensorState merged = SensorStates.merge(store.get(state.getId()), state);
                store.put(merged.getId(), merged);
                writes.incrementAndGet();
                return merged;
            }));
        });
    }

    public void put(SensorState state) {
        store.put(state.getId(), state);
    }

    /**
     * Stores {@code state} under {@code field} whatever its own id says.
     */
    public void putUnder(String field, SensorState state) {
        store.put(field, state);
    }

    public SensorState get(String sensorId) {
        return store.get(sensorId);
    }

    public int writeCount() {
        return writes.get();
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public void failWritesFor(String sensorId) {
        failingWrites.add(sensorId);
    }

    /**
     * Holds every write issued from now on until the returned action runs.
     */
    public Runnable holdWrites() {
        Sinks.Empty<Void> gate = Sinks.empty();
        writeGate = gate.asMono();
        return () -> {
            writeGate = Mono.empty();
            gate.tryEmitEmpty();
        };
    }

    private static StateCacheUnavailableException outage() {
        return new StateCacheUnavailableException("in-memory cache offline", new IllegalStateException("offline"));
    }
}
