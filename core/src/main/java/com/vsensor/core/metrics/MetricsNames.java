package com.vsensor.core.metrics;

/**
 * Micrometer metric names used by the tracker.
 * <p>
 * <b>Naming convention:</b> {@code vsensor.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} or {@code .duration} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Heartbeats received from the channel, valid or not.
     */
    public static final String HEARTBEAT_RECEIVED_TOTAL = "vsensor.heartbeat.received.total";

    /**
     * Counter: Heartbeats dropped by validation.
     * <p>
     * Tags: reason (unparseable/missing_field/invalid_field)
     * </p>
     */
    public static final String HEARTBEAT_REJECTED_TOTAL = "vsensor.heartbeat.rejected.total";

    /**
     * Distribution Summary: Heartbeat payload size (bytes).
     */
    public static final String HEARTBEAT_SIZE = "vsensor.heartbeat.size";

    /**
     * Counter: Sensors marked dead by the sweep.
     */
    public static final String SENSOR_DEAD_TOTAL = "vsensor.sensor.dead.total";

    /**
     * Timer: Duration of one dead-detection sweep.
     */
    public static final String SWEEP_DURATION = "vsensor.sweep.duration";

    /**
     * Counter: State cache operations abandoned because the store was unavailable.
     * <p>
     * Tags: op (ingest/sweep/read)
     * </p>
     */
    public static final String CACHE_FAILURES_TOTAL = "vsensor.cache.failures.total";

    /**
     * Gauge: Mutations queued or running on the per-key lanes.
     */
    public static final String MUTATIONS_PENDING = "vsensor.mutation.pending";

    /**
     * Counter: State changes handed to the notification fan-out.
     */
    public static final String NOTIFICATIONS_TOTAL = "vsensor.notify.total";

    /**
     * Counter: Notifications dropped on overflow.
     * <p>
     * Tags: stage (dispatcher/observer)
     * </p>
     */
    public static final String NOTIFICATIONS_DROPPED_TOTAL = "vsensor.notify.dropped.total";

    /**
     * Gauge: Connected WebSocket observers.
     */
    public static final String OBSERVERS = "vsensor.ws.observers";

    /**
     * Counter: Bytes sent to WebSocket observers.
     */
    public static final String NETWORK_OUTBOUND_WS_BYTES = "vsensor.ws.outbound.bytes";
}
