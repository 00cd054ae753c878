package com.vsensor.tracker.config;

import com.vsensor.core.msg.Channels;
import com.vsensor.core.msg.HeartbeatTransport;
import com.vsensor.core.redis.Keys;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration for a tracker node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class TrackerConfig {

    String nodeId;
    int httpPort;
    String redisUrl;
    Duration redisCommandTimeout;

    // Heartbeat channel
    HeartbeatTransport heartbeatTransport;
    String heartbeatChannel;
    String heartbeatTopic;
    String kafkaBootstrap;

    // State cache and liveness
    String stateCacheKey;
    Duration deadTimeout;
    Duration sweepInterval;
    int mutationLanes;

    // Notification fan-out
    int notificationBufferSize;
    int wsBufferSize;
    int wsPingIntervalSec;

    String sensorDbUrl;

    public static TrackerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static TrackerConfig fromEnv(Map<String, String> env) {
        Duration deadTimeout = Duration.ofMillis(Long.parseLong(getEnv(env, "DEAD_TIMEOUT", "2000")));
        String sweepIntervalMs = getEnv(env, "SWEEP_INTERVAL_MS", null);

        TrackerConfig config = TrackerConfig.builder()
            .nodeId(getEnv(env, "NODE_ID", "tracker-node-1"))
            .httpPort(Integer.parseInt(getEnv(env, "HTTP_PORT", "9090")))
            .redisUrl(getEnv(env, "REDIS_URL", "redis://localhost:6379"))
            .redisCommandTimeout(Duration.ofMillis(Long.parseLong(getEnv(env, "REDIS_COMMAND_TIMEOUT_MS", "1000"))))
            .heartbeatTransport(HeartbeatTransport.fromString(getEnv(env, "HEARTBEAT_TRANSPORT", "redis")))
            .heartbeatChannel(getEnv(env, "HEARTBEAT_CHANNEL", Channels.HEARTBEAT_CHANNEL))
            .heartbeatTopic(getEnv(env, "HEARTBEAT_TOPIC", Channels.HEARTBEAT_TOPIC))
            .kafkaBootstrap(getEnv(env, "KAFKA_BOOTSTRAP", "localhost:9092"))
            .stateCacheKey(getEnv(env, "STATE_CACHE_KEY", Keys.STATE_CACHE))
            .deadTimeout(deadTimeout)
            .sweepInterval(sweepIntervalMs != null ? Duration.ofMillis(Long.parseLong(sweepIntervalMs)) : deadTimeout)
            .mutationLanes(Integer.parseInt(getEnv(env, "MUTATION_LANES", "16")))
            .notificationBufferSize(Integer.parseInt(getEnv(env, "NOTIFICATION_BUFFER_SIZE", "1024")))
            .wsBufferSize(Integer.parseInt(getEnv(env, "WS_BUFFER_SIZE", "256")))
            .wsPingIntervalSec(Integer.parseInt(getEnv(env, "WS_PING_INTERVAL_SEC", "10")))
            .sensorDbUrl(getEnv(env, "SENSOR_DB_URL", "jdbc:sqlite:db/sensorGateway.sqlite"))
            .build();

        config.validate();
        return config;
    }

    /**
     * One-line summary for the startup log.
     */
    public String describe() {
        String channel = heartbeatTransport == HeartbeatTransport.KAFKA
            ? "kafka " + heartbeatTopic + " @ " + kafkaBootstrap
            : "redis " + heartbeatChannel;
        return String.format(
            "Heartbeat channel = %s | State cache = %s | HTTP port = %d | Dead timeout = %d ms | Sweep interval = %d ms",
            channel, stateCacheKey, httpPort, deadTimeout.toMillis(), sweepInterval.toMillis()
        );
    }

    private void validate() {
        if (deadTimeout.isNegative() || deadTimeout.isZero()) {
            throw new IllegalArgumentException("DEAD_TIMEOUT must be positive");
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("SWEEP_INTERVAL_MS must be positive");
        }
        if (mutationLanes < 1) {
            throw new IllegalArgumentException("MUTATION_LANES must be >= 1");
        }
        if (notificationBufferSize < 1 || wsBufferSize < 1) {
            throw new IllegalArgumentException("Notification buffer sizes must be >= 1");
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value != null ? value : defaultValue;
    }
}
