package com.vsensor.tracker.metrics;

import com.vsensor.core.metrics.MetricsNames;
import com.vsensor.core.metrics.MetricsTags;
import com.vsensor.core.msg.RejectReason;
import com.vsensor.tracker.config.TrackerConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics service for a tracker node.
 */
public class MetricsService {

    @Getter
    private final MeterRegistry registry;
    private final String nodeId;

    // Heartbeats
    private final Counter heartbeatsReceived;
    private final Map<RejectReason, Counter> heartbeatsRejected = new EnumMap<>(RejectReason.class);
    private final DistributionSummary heartbeatSize;

    // Liveness
    private final Counter sensorsDead;
    private final Timer sweepDuration;
    private final Map<String, Counter> cacheFailures = new ConcurrentHashMap<>();

    // Notifications
    private final Counter notifications;
    private final Counter notificationsDroppedDispatcher;
    private final Counter notificationsDroppedObserver;
    private final Counter networkOutboundWs;

    public MetricsService(MeterRegistry registry, TrackerConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        heartbeatsReceived = Counter.builder(MetricsNames.HEARTBEAT_RECEIVED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Heartbeats received from the channel")
            .register(registry);

        for (RejectReason reason : RejectReason.values()) {
            heartbeatsRejected.put(reason, Counter.builder(MetricsNames.HEARTBEAT_REJECTED_TOTAL)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.REASON, reason.tag())
                .description("Heartbeats dropped by validation")
                .register(registry));
        }

        heartbeatSize = DistributionSummary.builder(MetricsNames.HEARTBEAT_SIZE)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Heartbeat payload size distribution")
            .baseUnit("bytes")
            .register(registry);

        sensorsDead = Counter.builder(MetricsNames.SENSOR_DEAD_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Sensors marked dead by dead detection")
            .register(registry);

        sweepDuration = Timer.builder(MetricsNames.SWEEP_DURATION)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Dead detection sweep duration")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(500),
                Duration.ofMillis(1000)
            )
            .register(registry);

        notifications = Counter.builder(MetricsNames.NOTIFICATIONS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("State changes handed to the notification fan-out")
            .register(registry);

        notificationsDroppedDispatcher = Counter.builder(MetricsNames.NOTIFICATIONS_DROPPED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.STAGE, "dispatcher")
            .description("Notifications dropped because the fan-out fell behind")
            .register(registry);

        notificationsDroppedObserver = Counter.builder(MetricsNames.NOTIFICATIONS_DROPPED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.STAGE, "observer")
            .description("Notifications dropped because an observer fell behind")
            .register(registry);

        networkOutboundWs = Counter.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes sent to WebSocket observers")
            .baseUnit("bytes")
            .register(registry);
    }

    /**
     * Records a heartbeat as it arrives, before validation.
     *
     * @param bytes payload size
     */
    public void recordHeartbeatReceived(long bytes) {
        heartbeatsReceived.increment();
        heartbeatSize.record(bytes);
    }

    public void recordHeartbeatRejected(RejectReason reason) {
        heartbeatsRejected.get(reason).increment();
    }

    public void recordSensorDead() {
        sensorsDead.increment();
    }

    /**
     * Records the duration of one sweep cycle.
     *
     * @param startNanos {@link System#nanoTime()} at cycle start
     */
    public void recordSweep(long startNanos) {
        sweepDuration.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    /**
     * Records an operation abandoned because the state cache was unavailable.
     *
     * @param op ingest, sweep or read
     */
    public void recordCacheFailure(String op) {
        cacheFailures.computeIfAbsent(op, key -> Counter.builder(MetricsNames.CACHE_FAILURES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.OP, key)
            .description("State cache operations abandoned")
            .register(registry)
        ).increment();
    }

    public void recordNotification() {
        notifications.increment();
    }

    public void recordNotificationDroppedByDispatcher() {
        notificationsDroppedDispatcher.increment();
    }

    public void recordNotificationDroppedByObserver() {
        notificationsDroppedObserver.increment();
    }

    /**
     * Records bytes sent to a WebSocket observer.
     *
     * @param bytes number of bytes sent
     */
    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
    }

    public double getCacheFailureCount(String op) {
        Counter counter = cacheFailures.get(op);
        return counter == null ? 0 : counter.count();
    }

    public double getRejectedCount(RejectReason reason) {
        return heartbeatsRejected.get(reason).count();
    }

    public double getDeadCount() {
        return sensorsDead.count();
    }
}
