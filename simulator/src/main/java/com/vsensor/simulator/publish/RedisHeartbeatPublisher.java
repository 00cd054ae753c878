package com.vsensor.simulator.publish;

import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

public class RedisHeartbeatPublisher implements IHeartbeatPublisher {
    private static final Logger log = LoggerFactory.getLogger(RedisHeartbeatPublisher.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;
    private final String channel;

    public RedisHeartbeatPublisher(String redisUrl, String channel) {
        this.client = RedisClient.create(redisUrl);
        this.connection = client.connect();
        this.commands = connection.reactive();
        this.channel = channel;
        log.info("Publishing heartbeats to Redis channel {} at {}", channel, redisUrl);
    }

    @Override
    public Mono<Void> publish(String sensorId, String payload) {
        return commands.publish(channel, payload)
            .doOnNext(receivers -> log.debug("Heartbeat for {} reached {} subscriber(s)", sensorId, receivers))
            .then();
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
