package ch.fleetclash.sessionserver.web.api.controller;

import ch.fleetclash.sessionserver.service.ConnectionHub;
import ch.fleetclash.sessionserver.service.GameSessionEngine;
import ch.fleetclash.sessionserver.web.sse.SseEmitterTransport;
import io.swagger.v3.oas.annotations.Operation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

/**
 * Server-Sent Events endpoint. Each open stream is one hub connection. When the stream completes,
 * times out or fails, the hub is told the transport closed.
 *
 * <p>No {@code produces} on the mapping: the emitter sets {@code text/event-stream} itself, and
 * rejected subscriptions are answered with a JSON error body.
 */
@RestController
@Slf4j
public class GameEventStreamController {

    private final GameSessionEngine engine;
    private final ConnectionHub connectionHub;
    private final long sseTimeoutMs;

    public GameEventStreamController(GameSessionEngine engine,
                                     ConnectionHub connectionHub,
                                     @Value("${realtime.sse.timeout-ms:0}") long sseTimeoutMs) {
        this.engine = engine;
        this.connectionHub = connectionHub;
        this.sseTimeoutMs = sseTimeoutMs;
    }

    @Operation(summary = "Open the event stream of a player; pass reconnectToken to resume a dropped session")
    @GetMapping("/api/games/{gameId}/events")
    public SseEmitter subscribe(@PathVariable String gameId,
                                @RequestParam UUID playerId,
                                @RequestParam(required = false) String reconnectToken) {
        String playerName = engine.requirePlayerName(gameId, playerId);

        SseEmitter emitter = new SseEmitter(sseTimeoutMs);
        SseEmitterTransport transport = new SseEmitterTransport(emitter);

        connectionHub.subscribe(gameId, playerId, playerName, transport, reconnectToken);

        emitter.onCompletion(() -> closed(gameId, playerId, transport, "stream_closed"));
        emitter.onTimeout(() -> closed(gameId, playerId, transport, "stream_timeout"));
        emitter.onError(e -> closed(gameId, playerId, transport, "stream_error"));
        return emitter;
    }

    private void closed(String gameId, UUID playerId, SseEmitterTransport transport, String reason) {
        transport.markClosed();
        log.debug("SSE stream of player {} in game {} ended ({})", playerId, gameId, reason);
        connectionHub.handleTransportClosed(gameId, playerId, transport, reason);
    }
}
