package com.vsensor.core.msg;

/**
 * Default names of the heartbeat channel on each transport.
 */
public final class Channels {
    private Channels() {
    }

    /**
     * Redis pub/sub channel sensors publish heartbeats to.
     */
    public static final String HEARTBEAT_CHANNEL = "virtual-sensor-config";

    /**
     * Kafka topic used when heartbeats travel over Kafka.
     * Records are keyed by sensor id so one sensor always lands on one partition.
     */
    public static final String HEARTBEAT_TOPIC = "vsensor.heartbeats";

    /**
     * Consumer group shared by tracker nodes reading {@link #HEARTBEAT_TOPIC}.
     */
    public static final String TRACKER_CONSUMER_GROUP = "vsensor-tracker";
}
