package com.vsensor.simulator;

import com.vsensor.core.msg.HeartbeatTransport;
import com.vsensor.simulator.config.SimulatorConfig;
import com.vsensor.simulator.publish.IHeartbeatPublisher;
import com.vsensor.simulator.publish.KafkaHeartbeatPublisher;
import com.vsensor.simulator.publish.RedisHeartbeatPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.IntFunction;

/**
 * Publishes a heartbeat for every configured sensor at a fixed interval, for exercising a
 * tracker locally.
 */
public class SimulatorApp {
    private static final Logger log = LoggerFactory.getLogger(SimulatorApp.class);

    public static void main(String[] args) {
        SimulatorConfig config = SimulatorConfig.fromEnv();

        log.info("Starting heartbeat simulator: sensors={}, cluster={}, interval={} ms, transport={}",
            config.getSensorIds(), config.getCluster(), config.getInterval().toMillis(),
            config.getHeartbeatTransport());

        HeartbeatFactory factory = new HeartbeatFactory(
            config.getSensorIds(), config.getCluster(), HeartbeatFactory.readConfig(config.getConfigFile())
        );
        IHeartbeatPublisher publisher = config.getHeartbeatTransport() == HeartbeatTransport.KAFKA
            ? new KafkaHeartbeatPublisher(config.getKafkaBootstrap(), config.getHeartbeatTopic())
            : new RedisHeartbeatPublisher(config.getRedisUrl(), config.getHeartbeatChannel());

        Disposable ticker = Flux.interval(Duration.ZERO, config.getInterval())
            .onBackpressureDrop(tick -> log.warn("Publishing fell behind, skipping tick {}", tick))
            .concatMap(tick -> publishAll(factory, publisher, factory::heartbeat), 1)
            .subscribe();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, stopping simulator...");
            ticker.dispose();
            if (config.isDepartOnExit()) {
                publishAll(factory, publisher, factory::departure).block(Duration.ofSeconds(5));
                log.info("Departure sent for {} sensor(s)", factory.sensorIds().size());
            }
            publisher.close();
            log.info("Shutdown complete");
        }));

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static Mono<Void> publishAll(
        HeartbeatFactory factory, IHeartbeatPublisher publisher, IntFunction<String> payload
    ) {
        return Flux.range(0, factory.sensorIds().size())
            .concatMap(i -> publisher.publish(factory.sensorIds().get(i), payload.apply(i))
                .onErrorResume(err -> {
                    log.warn("Failed to publish heartbeat for {}: {}", factory.sensorIds().get(i), err.getMessage());
                    return Mono.empty();
                }))
            .then();
    }
}
