package com.vsensor.tracker.ws;

import com.vsensor.core.model.SensorState;
import com.vsensor.core.model.SensorStates;
import com.vsensor.core.util.BytesUtils;
import com.vsensor.tracker.config.TrackerConfig;
import com.vsensor.tracker.metrics.MetricsService;
import com.vsensor.tracker.notify.NotificationHub;
import com.vsensor.tracker.redis.IStateCache;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * Streams sensor state to one WebSocket observer.
 * <p>
 * Protocol (server → client): every cached {@link SensorState} as a snapshot, then every
 * subsequent change, one JSON object per text frame. Client frames are only logged.
 * </p>
 */
public class WebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

    private final TrackerConfig config;
    private final IStateCache cache;
    private final NotificationHub hub;
    private final MetricsService metricsService;

    public WebSocketHandler(TrackerConfig config, IStateCache cache, NotificationHub hub, MetricsService metricsService) {
        this.config = config;
        this.cache = cache;
        this.hub = hub;
        this.metricsService = metricsService;
    }

    public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound, String observerId) {
        log.info("Observer {} connected", observerId);

        inbound.withConnection(connection -> connection
            .onWriteIdle(config.getWsPingIntervalSec() * 1000L, () -> connection.outbound()
                .sendObject(Mono.just(new PingWebSocketFrame()))
                .then()
                .subscribe())
            .onDispose(() -> log.info("Observer {} disconnected", observerId)));

        return Mono.when(
                outbound.sendString(outboundMessages(observerId)),
                handleInboundMessages(inbound, observerId)
            )
            .onErrorResume(err -> {
                if (!(err instanceof AbortedException)) {
                    log.error("WebSocket error for observer {}", observerId, err);
                }
                return outbound.sendClose();
            });
    }

    Flux<String> outboundMessages(String observerId) {
        // Both are subscribed up front; live changes wait until the snapshot has been sent
        Flux<SensorState> snapshot = cache.getAll()
            .onErrorResume(err -> {
                log.warn("Snapshot unavailable for observer {}: {}", observerId, err.getMessage());
                return Flux.empty();
            });

        return Flux.mergeSequential(snapshot, hub.observe(config.getWsBufferSize()))
            .map(SensorStates::toJson)
            .doOnNext(json -> metricsService.recordNetworkOutboundWs(BytesUtils.utf8Length(json)));
    }

    private Mono<Void> handleInboundMessages(WebsocketInbound inbound, String observerId) {
        return inbound.aggregateFrames()
            .receive()
            .asString()
            .doOnNext(message -> log.debug("Ignoring frame from observer {}: {}", observerId, message))
            .onErrorResume(err -> {
                if (!(err instanceof AbortedException)) {
                    log.error("Inbound stream failed for observer {}", observerId, err);
                }
                return Mono.empty();
            })
            .then();
    }
}
