package com.vsensor.tracker.redis;

import com.vsensor.core.error.StateCacheUnavailableException;
import com.vsensor.core.model.SensorState;
import com.vsensor.core.model.SensorStates;
import io.lettuce.core.KeyValue;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * State cache stored as one Redis hash: field = sensor id, value = JSON record.
 * <p>
 * The read-merge-write in {@link #upsertMerge} is not atomic on its own. Callers serialize
 * writes per sensor id (see {@code KeyedMutationQueue}), which is what keeps it correct.
 * </p>
 */
public class RedisStateCache implements IStateCache {
    private static final Logger log = LoggerFactory.getLogger(RedisStateCache.class);

    private final RedisReactiveCommands<String, String> commands;
    private final String key;
    private final Duration timeout;

    public RedisStateCache(RedisReactiveCommands<String, String> commands, String key, Duration timeout) {
        this.commands = commands;
        this.key = key;
        this.timeout = timeout;
    }

    @Override
    public Flux<SensorState> getAll() {
        return commands.hgetall(key)
            .timeout(timeout)
            .onErrorMap(this::unavailable)
            .concatMap(entry -> Mono.justOrEmpty(decode(entry)));
    }

    @Override
    public Mono<SensorState> getOne(String sensorId) {
        return commands.hget(key, sensorId)
            .timeout(timeout)
            .onErrorMap(this::unavailable)
            .flatMap(json -> Mono.justOrEmpty(decode(sensorId, json)));
    }

    @Override
    public Mono<SensorState> upsertMerge(SensorState state) {
        return getOne(state.getId())
            .map(existing -> SensorStates.merge(existing, state))
            .defaultIfEmpty(SensorStates.merge(null, state))
            .flatMap(merged -> commands.hset(key, merged.getId(), SensorStates.toJson(merged))
                .timeout(timeout)
                .onErrorMap(this::unavailable)
                .thenReturn(merged));
    }

    private SensorState decode(KeyValue<String, String> entry) {
        return entry.hasValue() ? decode(entry.getKey(), entry.getValue()) : null;
    }

    /**
     * The hash field is the sensor id; a record whose own {@code id} is missing or disagrees
     * is read under the field.
     */
    private SensorState decode(String sensorId, String json) {
        SensorState state;
        try {
            state = SensorStates.fromJson(json);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping unreadable state cache entry {}: {}", sensorId, e.getMessage());
            return null;
        }
        if (!sensorId.equals(state.getId())) {
            log.warn("State cache entry {} carries id {}, using the field", sensorId, state.getId());
            return state.withId(sensorId);
        }
        return state;
    }

    private Throwable unavailable(Throwable err) {
        if (err instanceof StateCacheUnavailableException) {
            return err;
        }
        return new StateCacheUnavailableException("State cache " + key + " unavailable: " + err.getMessage(), err);
    }
}
