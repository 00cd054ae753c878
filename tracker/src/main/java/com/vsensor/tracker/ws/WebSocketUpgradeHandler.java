package com.vsensor.tracker.ws;

import io.netty.handler.codec.http.QueryStringDecoder;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.Collection;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Extracts the optional {@code observerId} query parameter and upgrades to WebSocket.
 */
public class WebSocketUpgradeHandler {
    private final WebSocketHandler wsHandler;

    public WebSocketUpgradeHandler(WebSocketHandler wsHandler) {
        this.wsHandler = wsHandler;
    }

    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        String observerId = observerId(req.uri());
        return res.sendWebsocket((inbound, outbound) -> wsHandler.handle(inbound, outbound, observerId));
    }

    static String observerId(String uri) {
        QueryStringDecoder decoder = new QueryStringDecoder(uri);
        return Stream.ofNullable(decoder.parameters().get("observerId"))
            .flatMap(Collection::stream).findFirst()
            .orElseGet(() -> UUID.randomUUID().toString());
    }
}
