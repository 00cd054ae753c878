package com.vsensor.tracker.liveness;

import com.vsensor.core.model.SensorState;
import com.vsensor.tracker.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.util.function.Consumer;

/**
 * Hands state changes to the notification callback without ever blocking the caller.
 * <p>
 * Changes wait in a bounded buffer drained on {@code scheduler}. When the callback falls
 * behind and the buffer is full, the oldest waiting change is dropped and counted.
 * Callback failures are logged and do not stop delivery.
 * </p>
 */
public class NotificationDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final Sinks.Many<SensorState> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final MetricsService metrics;
    private final Disposable drain;

    public NotificationDispatcher(
        Consumer<SensorState> callback, int capacity, Scheduler scheduler, MetricsService metrics
    ) {
        this.metrics = metrics;
        this.drain = sink.asFlux()
            .onBackpressureBuffer(capacity, this::onDropped, BufferOverflowStrategy.DROP_OLDEST)
            .publishOn(scheduler, 1)
            .subscribe(state -> deliver(callback, state));
    }

    /**
     * Queues a state change for delivery.
     */
    public synchronized void dispatch(SensorState state) {
        Sinks.EmitResult result = sink.tryEmitNext(state);
        if (result.isFailure()) {
            log.warn("Notification for {} not queued: {}", state.getId(), result);
            return;
        }
        metrics.recordNotification();
    }

    private void deliver(Consumer<SensorState> callback, SensorState state) {
        try {
            callback.accept(state);
        } catch (RuntimeException e) {
            log.error("Notification callback failed for sensor {}", state.getId(), e);
        }
    }

    private void onDropped(SensorState state) {
        log.warn("Notification buffer full, dropped oldest change for sensor {}", state.getId());
        metrics.recordNotificationDroppedByDispatcher();
    }

    @Override
    public synchronized void close() {
        sink.tryEmitComplete();
        drain.dispose();
    }
}
