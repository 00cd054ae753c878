package com.vsensor.tracker.notify;

import com.vsensor.core.metrics.MetricsNames;
import com.vsensor.core.metrics.MetricsTags;
import com.vsensor.core.model.SensorState;
import com.vsensor.tracker.metrics.MetricsService;
import io.micrometer.core.instrument.Gauge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Broadcasts state changes to every connected observer.
 * <p>
 * Each observer gets its own bounded buffer; an observer that cannot keep up loses its
 * oldest pending changes and never slows down the others.
 * </p>
 */
public class NotificationHub {
    private static final Logger log = LoggerFactory.getLogger(NotificationHub.class);

    private final Sinks.Many<SensorState> sink = Sinks.many().multicast().directBestEffort();
    private final AtomicInteger observers = new AtomicInteger();
    private final MetricsService metrics;

    public NotificationHub(MetricsService metrics, String nodeId) {
        this.metrics = metrics;
        Gauge.builder(MetricsNames.OBSERVERS, observers, AtomicInteger::get)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Connected WebSocket observers")
            .register(metrics.getRegistry());
    }

    /**
     * Delivers one change to all current observers. Used as the notification callback.
     */
    public synchronized void broadcast(SensorState state) {
        Sinks.EmitResult result = sink.tryEmitNext(state);
        if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("No observers for change of sensor {}", state.getId());
        } else if (result.isFailure()) {
            log.warn("Broadcast of sensor {} failed: {}", state.getId(), result);
        }
    }

    /**
     * Live changes from now on, buffered per observer.
     *
     * @param bufferSize pending changes kept for this observer
     */
    public Flux<SensorState> observe(int bufferSize) {
        return sink.asFlux()
            .onBackpressureBuffer(bufferSize, dropped -> {
                log.debug("Observer fell behind, dropped change of sensor {}", dropped.getId());
                metrics.recordNotificationDroppedByObserver();
            }, BufferOverflowStrategy.DROP_OLDEST)
            .doOnSubscribe(s -> observers.incrementAndGet())
            .doFinally(signal -> observers.decrementAndGet());
    }

    public int observerCount() {
        return observers.get();
    }
}
