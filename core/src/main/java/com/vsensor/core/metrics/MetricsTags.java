package com.vsensor.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for drop/reject reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for the cache operation that failed.
     */
    public static final String OP = "op";

    /**
     * Tag key for the notification stage that dropped a message.
     */
    public static final String STAGE = "stage";
}
