package com.vsensor.tracker.support;

import io.lettuce.core.KeyValue;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Reactive Redis commands over in-memory hashes. Only the hash commands the state cache
 * issues are answered; everything else fails loudly.
 */
public class StubRedisCommands implements InvocationHandler {
    private final Map<String, Map<String, String>> hashes = new ConcurrentHashMap<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private volatile RuntimeException readFailure;
    private volatile RuntimeException writeFailure;
    private volatile boolean readsHang;

    @SuppressWarnings("unchecked")
    public RedisReactiveCommands<String, String> commands() {
        return (RedisReactiveCommands<String, String>) Proxy.newProxyInstance(
            RedisReactiveCommands.class.getClassLoader(),
            new Class<?>[]{RedisReactiveCommands.class},
            this
        );
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) {
        String name = method.getName();
        int arity = args == null ? 0 : args.length;
        if (name.equals("hgetall") && arity == 1) {
            return hgetall((String) args[0]);
        }
        if (name.equals("hget") && arity == 2) {
            return hget((String) args[0], (String) args[1]);
        }
        if (name.equals("hset") && arity == 3) {
            return hset((String) args[0], (String) args[1], (String) args[2]);
        }
        if (name.equals("toString") && arity == 0) {
            return "StubRedisCommands";
        }
        if (name.equals("hashCode") && arity == 0) {
            return System.identityHashCode(proxy);
        }
        if (name.equals("equals") && arity == 1) {
            return proxy == args[0];
        }
        throw new UnsupportedOperationException("Not stubbed: " + method);
    }

    private Flux<KeyValue<String, String>> hgetall(String key) {
        return Flux.defer(() -> {
            calls.add("HGETALL " + key);
            if (readFailure != null) {
                return Flux.error(readFailure);
            }
            List<KeyValue<String, String>> entries = new ArrayList<>();
            hash(key).forEach((field, value) -> entries.add(KeyValue.just(field, value)));
            return Flux.fromIterable(entries);
        });
    }

    private Mono<String> hget(String key, String field) {
        return Mono.defer(() -> {
            calls.add("HGET " + key + " " + field);
            if (readsHang) {
                return Mono.never();
            }
            if (readFailure != null) {
                return Mono.error(readFailure);
            }
            return Mono.justOrEmpty(hash(key).get(field));
        });
    }

    private Mono<Boolean> hset(String key, String field, String value) {
        return Mono.defer(() -> {
            calls.add("HSET " + key + " " + field);
            if (writeFailure != null) {
                return Mono.error(writeFailure);
            }
            return Mono.just(hash(key).put(field, value) == null);
        });
    }

    private Map<String, String> hash(String key) {
        return hashes.computeIfAbsent(key, k -> new ConcurrentHashMap<>());
    }

    public void put(String key, String field, String value) {
        hash(key).put(field, value);
    }

    public String get(String key, String field) {
        return hash(key).get(field);
    }

    public List<String> calls() {
        return calls;
    }

    public void failReads(RuntimeException failure) {
        this.readFailure = failure;
    }

    public void failWrites(RuntimeException failure) {
        this.writeFailure = failure;
    }

    public void hangReads() {
        this.readsHang = true;
    }
}
