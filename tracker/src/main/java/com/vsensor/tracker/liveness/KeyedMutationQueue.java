package com.vsensor.tracker.liveness;

import com.vsensor.core.hash.Hashers;
import com.vsensor.core.metrics.MetricsNames;
import com.vsensor.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Serializes mutations per key.
 * <p>
 * Keys are hashed onto a fixed number of lanes. Each lane runs its mutations strictly one
 * after another in submission order; different lanes run in parallel. Two mutations of the
 * same key therefore never interleave, while unrelated sensors do not wait on each other
 * (beyond sharing a lane).
 * </p>
 * <p>
 * A mutation is enqueued when {@link #submit} is called, not when the returned {@link Mono}
 * is subscribed. Its position in the lane is fixed at that moment.
 * </p>
 */
public class KeyedMutationQueue implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KeyedMutationQueue.class);

    private final List<Sinks.Many<Mono<Void>>> lanes;
    private final Scheduler scheduler;
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicInteger openLanes;
    private final Sinks.Empty<Void> drained = Sinks.empty();

    public KeyedMutationQueue(int laneCount, MeterRegistry registry, String nodeId) {
        if (laneCount < 1) {
            throw new IllegalArgumentException("laneCount must be >= 1");
        }
        this.scheduler = Schedulers.newBoundedElastic(laneCount, Integer.MAX_VALUE, "vsensor-mutation");
        this.lanes = new ArrayList<>(laneCount);
        this.openLanes = new AtomicInteger(laneCount);

        for (int i = 0; i < laneCount; i++) {
            Sinks.Many<Mono<Void>> lane = Sinks.many().unicast().onBackpressureBuffer();
            int laneIndex = i;
            lane.asFlux()
                .publishOn(scheduler)
                .concatMap(task -> task)
                .subscribe(
                    v -> { },
                    err -> {
                        log.error("Mutation lane {} terminated unexpectedly", laneIndex, err);
                        onLaneClosed();
                    },
                    this::onLaneClosed
                );
            lanes.add(lane);
        }

        Gauge.builder(MetricsNames.MUTATIONS_PENDING, pending, AtomicInteger::get)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Mutations queued or running across all lanes")
            .register(registry);

        log.info("Keyed mutation queue started with {} lanes", laneCount);
    }

    /**
     * Enqueues a mutation on the lane of {@code key}.
     *
     * @param key      sensor id
     * @param mutation produces the mutation; invoked on the lane when its turn comes
     * @return the mutation's outcome. A failed mutation fails this {@code Mono} but never the lane.
     */
    public <T> Mono<T> submit(String key, Supplier<Mono<T>> mutation) {
        Sinks.One<T> result = Sinks.one();

        Mono<Void> task = Mono.defer(mutation)
            .doOnSuccess(value -> {
                if (value == null) {
                    result.tryEmitEmpty();
                } else {
                    result.tryEmitValue(value);
                }
            })
            .doOnError(result::tryEmitError)
            .onErrorResume(err -> Mono.empty())
            .doFinally(signal -> pending.decrementAndGet())
            .then();

        Sinks.Many<Mono<Void>> lane = lanes.get(Hashers.laneFor(key, lanes.size()));
        pending.incrementAndGet();
        Sinks.EmitResult emitted;
        synchronized (lane) {
            emitted = lane.tryEmitNext(task);
        }
        if (emitted.isFailure()) {
            pending.decrementAndGet();
            return Mono.error(new IllegalStateException("Mutation queue is closed (" + emitted + ")"));
        }
        return result.asMono();
    }

    public int pendingCount() {
        return pending.get();
    }

    /**
     * Completes once {@link #close} was called and every mutation queued before it has run.
     */
    public Mono<Void> whenDrained() {
        return drained.asMono();
    }

    /**
     * Stops accepting mutations. Already queued mutations still run; the lane threads are
     * released once every lane has drained.
     */
    @Override
    public void close() {
        for (Sinks.Many<Mono<Void>> lane : lanes) {
            synchronized (lane) {
                lane.tryEmitComplete();
            }
        }
    }

    private void onLaneClosed() {
        if (openLanes.decrementAndGet() == 0) {
            scheduler.dispose();
            drained.tryEmitEmpty();
            log.info("Keyed mutation queue drained and closed");
        }
    }
}
