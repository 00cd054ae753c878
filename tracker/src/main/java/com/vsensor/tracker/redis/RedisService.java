package com.vsensor.tracker.redis;

import com.vsensor.tracker.config.TrackerConfig;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import io.lettuce.core.pubsub.api.reactive.RedisPubSubReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

/**
 * Owns the Lettuce client and its two connections: one for hash commands and one dedicated
 * to pub/sub, since a subscribed connection cannot issue regular commands.
 */
public class RedisService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RedisService.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final StatefulRedisPubSubConnection<String, String> pubSubConnection;
    private final RedisReactiveCommands<String, String> commands;
    private final RedisPubSubReactiveCommands<String, String> pubSub;

    public RedisService(TrackerConfig config) {
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.pubSubConnection = client.connectPubSub();
        this.commands = connection.reactive();
        this.pubSub = pubSubConnection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    public RedisReactiveCommands<String, String> commands() {
        return commands;
    }

    /**
     * Subscribes to a pub/sub channel.
     * <p>
     * The subscription is issued when the returned flux is subscribed and released when it
     * terminates or is cancelled.
     * </p>
     *
     * @param channel channel name
     * @return messages published on the channel, in arrival order
     */
    public Flux<String> subscribe(String channel) {
        return pubSub.subscribe(channel)
            .doOnSuccess(v -> log.info("Subscribed to Redis channel {}", channel))
            .thenMany(pubSub.observeChannels()
                .filter(message -> channel.equals(message.getChannel()))
                .map(message -> message.getMessage()))
            .doFinally(signal -> pubSub.unsubscribe(channel)
                .subscribe(
                    v -> { },
                    err -> log.warn("Failed to unsubscribe from {}: {}", channel, err.getMessage())
                ));
    }

    @Override
    public void close() {
        pubSubConnection.close();
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
