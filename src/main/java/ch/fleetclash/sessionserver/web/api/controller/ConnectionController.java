package ch.fleetclash.sessionserver.web.api.controller;

import ch.fleetclash.sessionserver.domain.DisconnectedSession;
import ch.fleetclash.sessionserver.exception.ExpiredCredentialException;
import ch.fleetclash.sessionserver.service.ConnectionHub;
import ch.fleetclash.sessionserver.service.GameRegistry;
import ch.fleetclash.sessionserver.service.GameSessionEngine;
import ch.fleetclash.sessionserver.service.ReconnectionManager;
import ch.fleetclash.sessionserver.web.api.dto.ConnectionStatsDto;
import ch.fleetclash.sessionserver.web.api.dto.ReconnectRequest;
import ch.fleetclash.sessionserver.web.api.dto.ReconnectResponseDto;
import ch.fleetclash.sessionserver.web.api.dto.ReconnectionTokenDto;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Reconnection handshake and connection monitoring.
 */
@RestController
@RequiredArgsConstructor
public class ConnectionController {

    private final ConnectionHub connectionHub;
    private final ReconnectionManager reconnectionManager;
    private final GameSessionEngine engine;
    private final GameRegistry registry;

    @Operation(summary = "Redeem a reconnection token without opening a stream")
    @PostMapping("/api/games/{gameId}/reconnect")
    public ResponseEntity<ReconnectResponseDto> reconnect(@PathVariable String gameId,
                                                          @RequestBody ReconnectRequest request) {
        engine.requirePlayerName(gameId, request.playerId());
        DisconnectedSession session = reconnectionManager.tryReconnect(
                gameId, request.playerId(), request.reconnectionToken());
        return ResponseEntity.ok(new ReconnectResponseDto(gameId, session.playerId(), session.sessionId()));
    }

    @Operation(summary = "Fetch the reconnection token of a disconnected player")
    @GetMapping("/api/games/{gameId}/players/{playerId}/reconnection-token")
    public ResponseEntity<ReconnectionTokenDto> reconnectionToken(@PathVariable String gameId,
                                                                  @PathVariable UUID playerId) {
        engine.requirePlayerName(gameId, playerId);
        DisconnectedSession session = reconnectionManager.findSession(gameId, playerId)
                .orElseThrow(() -> new ExpiredCredentialException("No reconnection window open for this player"));
        return ResponseEntity.ok(new ReconnectionTokenDto(
                gameId, playerId, session.reconnectionToken(), session.expiresAt()));
    }

    @Operation(summary = "List players of a game that are currently connected")
    @GetMapping("/api/games/{gameId}/connections")
    public ResponseEntity<List<UUID>> connectedPlayers(@PathVariable String gameId) {
        return ResponseEntity.ok(connectionHub.connectedPlayers(gameId));
    }

    @Operation(summary = "Connection statistics")
    @GetMapping("/api/connections/stats")
    public ResponseEntity<ConnectionStatsDto> stats() {
        return ResponseEntity.ok(new ConnectionStatsDto(
                connectionHub.connectionCount(),
                connectionHub.connectionsPerGame(),
                reconnectionManager.size(),
                registry.size()
        ));
    }
}
