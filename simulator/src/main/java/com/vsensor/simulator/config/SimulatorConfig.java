package com.vsensor.simulator.config;

import com.vsensor.core.msg.Channels;
import com.vsensor.core.msg.HeartbeatTransport;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Configuration for the heartbeat simulator, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SimulatorConfig {

    List<String> sensorIds;
    String cluster;
    Duration interval;
    /**
     * Optional JSON file whose object is sent as every heartbeat's {@code config}.
     */
    String configFile;
    boolean departOnExit;

    HeartbeatTransport heartbeatTransport;
    String redisUrl;
    String heartbeatChannel;
    String heartbeatTopic;
    String kafkaBootstrap;

    public static SimulatorConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static SimulatorConfig fromEnv(Map<String, String> env) {
        List<String> sensorIds = Arrays.stream(getEnv(env, "SIM_SENSOR_IDS", "H60001,H60002").split(","))
            .map(String::trim)
            .filter(id -> !id.isEmpty())
            .collect(Collectors.toList());
        if (sensorIds.isEmpty()) {
            throw new IllegalArgumentException("SIM_SENSOR_IDS must name at least one sensor");
        }

        long intervalMs = Long.parseLong(getEnv(env, "SIM_INTERVAL_MS", "1000"));
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("SIM_INTERVAL_MS must be positive");
        }

        return SimulatorConfig.builder()
            .sensorIds(List.copyOf(sensorIds))
            .cluster(getEnv(env, "SIM_CLUSTER", "H6"))
            .interval(Duration.ofMillis(intervalMs))
            .configFile(getEnv(env, "SIM_CONFIG_FILE", null))
            .departOnExit(Boolean.parseBoolean(getEnv(env, "SIM_DEPART_ON_EXIT", "false")))
            .heartbeatTransport(HeartbeatTransport.fromString(getEnv(env, "HEARTBEAT_TRANSPORT", "redis")))
            .redisUrl(getEnv(env, "REDIS_URL", "redis://localhost:6379"))
            .heartbeatChannel(getEnv(env, "HEARTBEAT_CHANNEL", Channels.HEARTBEAT_CHANNEL))
            .heartbeatTopic(getEnv(env, "HEARTBEAT_TOPIC", Channels.HEARTBEAT_TOPIC))
            .kafkaBootstrap(getEnv(env, "KAFKA_BOOTSTRAP", "localhost:9092"))
            .build();
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value != null ? value : defaultValue;
    }
}
