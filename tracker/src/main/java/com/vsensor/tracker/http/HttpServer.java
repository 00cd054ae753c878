package com.vsensor.tracker.http;

import com.vsensor.core.error.StateCacheUnavailableException;
import com.vsensor.core.model.SensorState;
import com.vsensor.core.util.JsonUtils;
import com.vsensor.tracker.config.TrackerConfig;
import com.vsensor.tracker.liveness.LivenessManager;
import com.vsensor.tracker.metrics.PrometheusMetricsExporter;
import com.vsensor.tracker.redis.IStateCache;
import com.vsensor.tracker.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerResponse;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * HTTP server for health checks, metrics, the sensor snapshot and WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String APPLICATION_JSON = "application/json";

    private final TrackerConfig config;
    private final IStateCache cache;
    private final LivenessManager livenessManager;
    private final PrometheusMetricsExporter metricsExporter;
    private final WebSocketUpgradeHandler upgradeHandler;
    private DisposableServer server;

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                // Ready once the heartbeat channel is being consumed
                .get("/readyz", (req, res) -> {
                    if (!livenessManager.isRunning()) {
                        return res.status(503).sendString(Mono.just("Not Ready"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", PrometheusMetricsExporter.CONTENT_TYPE)
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .get("/sensors", (req, res) -> cache.getAll()
                    .collectList()
                    .flatMap(states -> sendJson(res, 200, JsonUtils.writeValueAsString(states)))
                    .onErrorResume(StateCacheUnavailableException.class, err -> unavailable(res, err)))
                .get("/sensors/{id}", (req, res) -> {
                    String sensorId = req.param("id");
                    return cache.getOne(sensorId)
                        .map(Optional::of)
                        .defaultIfEmpty(Optional.empty())
                        .flatMap(state -> sendSensor(res, sensorId, state))
                        .onErrorResume(StateCacheUnavailableException.class, err -> unavailable(res, err));
                })
                .get("/ws", upgradeHandler::handle)
            )
            .bind()
            .doOnNext(s -> log.info("HTTP server started on port {}", s.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    private Mono<Void> sendSensor(HttpServerResponse res, String sensorId, Optional<SensorState> state) {
        if (state.isEmpty()) {
            return sendJson(res, 404, JsonUtils.writeValueAsString(
                Map.of("error", "Unknown sensor " + sensorId)));
        }
        return sendJson(res, 200, JsonUtils.writeValueAsString(state.get()));
    }

    private Mono<Void> sendJson(HttpServerResponse res, int status, String json) {
        return res.status(status)
            .header("Content-Type", APPLICATION_JSON)
            .sendString(Mono.just(json))
            .then();
    }

    private Mono<Void> unavailable(HttpServerResponse res, Throwable err) {
        log.error("Sensor snapshot request failed: {}", err.getMessage());
        return res.status(503).sendString(Mono.just("State cache unavailable")).then();
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
