package ch.fleetclash.sessionserver.domain;

import ch.fleetclash.sessionserver.service.transport.PushTransport;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * Live push channel of one player in one game.
 *
 * <p>Connections exist only in memory: created on subscribe, dropped on close or eviction.
 * {@link #lastHeartbeat} is refreshed whenever a heartbeat write succeeds and is the basis
 * for stale-connection eviction.
 */
@Getter
public class PlayerConnection {

    private final String gameId;
    private final UUID playerId;
    private final String playerName;
    private final String sessionId;
    private final PushTransport transport;
    private final Instant connectedAt;
    private volatile Instant lastHeartbeat;

    public PlayerConnection(String gameId, UUID playerId, String playerName, String sessionId,
                            PushTransport transport, Instant connectedAt) {
        this.gameId = gameId;
        this.playerId = playerId;
        this.playerName = playerName;
        this.sessionId = sessionId;
        this.transport = transport;
        this.connectedAt = connectedAt;
        this.lastHeartbeat = connectedAt;
    }

    public void markHeartbeat(Instant now) {
        this.lastHeartbeat = now;
    }

    public boolean isStale(Instant threshold) {
        return lastHeartbeat.isBefore(threshold);
    }
}
