package com.vsensor.tracker.heartbeat;

import com.vsensor.core.util.JitterBackoff;
import com.vsensor.tracker.redis.RedisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Heartbeats from a Redis pub/sub channel.
 */
public class RedisHeartbeatSource implements IHeartbeatSource {
    private static final Logger log = LoggerFactory.getLogger(RedisHeartbeatSource.class);

    private final RedisService redisService;
    private final String channel;

    public RedisHeartbeatSource(RedisService redisService, String channel) {
        this.redisService = redisService;
        this.channel = channel;
    }

    @Override
    public Flux<String> heartbeats() {
        return redisService.subscribe(channel)
            .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                long attempt = signal.totalRetriesInARow();
                log.warn("Heartbeat channel {} failed (attempt {}), resubscribing: {}",
                    channel, attempt + 1, signal.failure().getMessage());
                return Mono.delay(JitterBackoff.next(attempt));
            })));
    }

    @Override
    public void close() {
        log.info("Redis heartbeat source for {} closed", channel);
    }
}
