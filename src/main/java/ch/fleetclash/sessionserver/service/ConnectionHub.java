package ch.fleetclash.sessionserver.service;

import ch.fleetclash.sessionserver.domain.DisconnectedSession;
import ch.fleetclash.sessionserver.domain.PlayerConnection;
import ch.fleetclash.sessionserver.service.transport.PushTransport;
import ch.fleetclash.sessionserver.web.api.dto.GameEventDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of live push channels and fan-out of game events.
 *
 * <p>Connections are keyed by (game, player): a player has at most one live channel per game, and a
 * new subscription replaces the old one. A per-game index keeps fan-out proportional to the
 * subscribers of that game.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>A failed write evicts only that connection; the remaining subscribers still get the event
 *       and the operation that caused the broadcast is not affected.</li>
 *   <li>An eviction (failed write, heartbeat timeout, transport closed) is treated as a disconnect:
 *       other players are told, and the {@link ReconnectionManager} opens a reconnection window.</li>
 *   <li>A replaced or administratively closed connection opens no reconnection window.</li>
 * </ul>
 *
 * <p>Heartbeats go out every {@code realtime.heartbeat.interval-ms} (default 30s); every
 * {@code realtime.stale-sweep.interval-ms} (default 60s) connections whose last successful heartbeat
 * is older than {@code realtime.heartbeat.timeout-ms} (default 90s) are evicted.
 */
@Service
@Slf4j
public class ConnectionHub {

    private final ReconnectionManager reconnectionManager;
    private final Clock clock;
    private final long heartbeatTimeoutMs;

    private final Map<ConnectionKey, PlayerConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<ConnectionKey>> gameIndex = new ConcurrentHashMap<>();

    public ConnectionHub(ReconnectionManager reconnectionManager,
                         Clock clock,
                         @Value("${realtime.heartbeat.timeout-ms:90000}") long heartbeatTimeoutMs) {
        this.reconnectionManager = reconnectionManager;
        this.clock = clock;
        this.heartbeatTimeoutMs = heartbeatTimeoutMs;
    }

    /**
     * Result of a subscription.
     *
     * @param sessionId   session id of the new connection (reused from the old session on reconnect)
     * @param reconnected {@code true} if a reconnection token was redeemed
     */
    public record Subscription(String sessionId, boolean reconnected) {}

    /**
     * Attaches a push channel for a player.
     *
     * <p>With a reconnect token the token is redeemed first (failing with
     * {@link ch.fleetclash.sessionserver.exception.ExpiredCredentialException} if it is not valid),
     * the previous session id is kept, the other players are told and the engine is signalled.
     * Without a token a fresh session id is minted.
     *
     * @param gameId         game to subscribe to (membership is checked by the caller)
     * @param playerId       subscribing player
     * @param playerName     display name used in connection events
     * @param transport      channel to write to
     * @param reconnectToken optional reconnection token
     */
    public Subscription subscribe(String gameId, UUID playerId, String playerName,
                                  PushTransport transport, String reconnectToken) {
        DisconnectedSession restored = reconnectToken == null || reconnectToken.isBlank()
                ? null
                : reconnectionManager.consume(gameId, playerId, reconnectToken);
        String sessionId = restored != null ? restored.sessionId() : UUID.randomUUID().toString();
        boolean reconnected = restored != null;

        ConnectionKey key = new ConnectionKey(gameId, playerId);
        Instant now = clock.instant();
        PlayerConnection connection = new PlayerConnection(gameId, playerId, playerName, sessionId, transport, now);

        PlayerConnection replaced = connections.put(key, connection);
        index(key);
        if (replaced != null) {
            log.debug("Replacing existing connection of player {} in game {}", playerName, gameId);
            closeQuietly(replaced);
        }

        log.info("Player {} {} game {} (session {})",
                playerName, reconnected ? "reconnected to" : "connected to", gameId, sessionId);

        if (!deliver(connection, GameEventDto.connectionEstablished(connection, reconnected, now))) {
            evict(connection, "write_failed");
            return new Subscription(sessionId, reconnected);
        }

        if (reconnected) {
            publish(gameId, GameEventDto.playerReconnected(connection, now), playerId);
            reconnectionManager.notifyReconnected(gameId, playerId);
        }
        return new Subscription(sessionId, reconnected);
    }

    /**
     * Writes an event to every subscriber of a game except the excluded player.
     *
     * @param excludePlayerId player that should not receive the event, may be {@code null}
     * @return number of successful writes
     */
    public int publish(String gameId, GameEventDto event, UUID excludePlayerId) {
        List<PlayerConnection> failed = new ArrayList<>();
        int delivered = 0;

        for (PlayerConnection connection : connectionsOf(gameId)) {
            if (connection.getPlayerId().equals(excludePlayerId)) {
                continue;
            }
            if (deliver(connection, event)) {
                delivered++;
            } else {
                failed.add(connection);
            }
        }

        for (PlayerConnection connection : failed) {
            evict(connection, "write_failed");
        }

        log.debug("Published {} to game {}: {} delivered, {} failed",
                event.type().wireName(), gameId, delivered, failed.size());
        return delivered;
    }

    public int publish(String gameId, GameEventDto event) {
        return publish(gameId, event, null);
    }

    /**
     * Handles the end of a connection reported by its transport (stream completed, socket closed).
     *
     * <p>Ignored unless the transport still backs the player's live connection, so late close
     * callbacks of a replaced transport cannot disconnect its successor.
     */
    public void handleTransportClosed(String gameId, UUID playerId, PushTransport transport, String reason) {
        PlayerConnection connection = connections.get(new ConnectionKey(gameId, playerId));
        if (connection == null || connection.getTransport() != transport) {
            log.debug("Ignoring close of a transport no longer attached to player {} in game {}", playerId, gameId);
            return;
        }
        evict(connection, reason);
    }

    /**
     * Removes a live connection and treats it as a disconnect: the other players are told and a
     * reconnection window is opened. Does nothing if the connection is no longer live.
     */
    private void evict(PlayerConnection connection, String reason) {
        String gameId = connection.getGameId();
        UUID playerId = connection.getPlayerId();
        ConnectionKey key = new ConnectionKey(gameId, playerId);
        if (!connections.remove(key, connection)) {
            return;
        }
        unindex(key);
        closeQuietly(connection);

        Instant now = clock.instant();
        int remaining = connectionsOf(gameId).size();
        log.info("Connection of player {} in game {} closed ({})", connection.getPlayerName(), gameId, reason);

        publish(gameId, GameEventDto.playerDisconnected(connection, remaining, reason, now), playerId);
        DisconnectedSession session = reconnectionManager.recordDisconnect(connection);
        publish(gameId, GameEventDto.reconnectionAvailable(session, now), playerId);
    }

    /**
     * Closes every connection of a game without opening reconnection windows.
     *
     * @return number of closed connections
     */
    public int closeGame(String gameId) {
        Set<ConnectionKey> keys = gameIndex.remove(gameId);
        if (keys == null) {
            return 0;
        }
        int closed = 0;
        for (ConnectionKey key : keys) {
            PlayerConnection connection = connections.remove(key);
            if (connection != null) {
                closeQuietly(connection);
                closed++;
            }
        }
        log.info("Closed {} connection(s) of game {}", closed, gameId);
        return closed;
    }

    /**
     * Sends a heartbeat to every connection. A successful write refreshes the connection's
     * heartbeat timestamp, a failed one evicts it.
     */
    @Scheduled(fixedRateString = "${realtime.heartbeat.interval-ms:30000}")
    public void sendHeartbeats() {
        Instant now = clock.instant();
        List<PlayerConnection> targets = List.copyOf(connections.values());
        List<PlayerConnection> failed = new ArrayList<>();
        for (PlayerConnection connection : targets) {
            if (deliver(connection, GameEventDto.heartbeat(connection.getGameId(), now))) {
                connection.markHeartbeat(now);
            } else {
                failed.add(connection);
            }
        }
        failed.forEach(c -> evict(c, "heartbeat_failed"));
        log.debug("Heartbeat round: {} connection(s), {} failed", targets.size(), failed.size());
    }

    @Scheduled(fixedRateString = "${realtime.stale-sweep.interval-ms:60000}")
    public void evictStaleConnections() {
        evictStale();
    }

    /**
     * Evicts connections without a successful heartbeat within the timeout, treating them as disconnected.
     *
     * @return number of evicted connections
     */
    public int evictStale() {
        Instant threshold = clock.instant().minus(Duration.ofMillis(heartbeatTimeoutMs));
        List<PlayerConnection> stale = connections.values().stream()
                .filter(c -> c.isStale(threshold))
                .toList();
        stale.forEach(c -> evict(c, "heartbeat_timeout"));
        if (!stale.isEmpty()) {
            log.info("Evicted {} stale connection(s)", stale.size());
        }
        return stale.size();
    }

    public Optional<PlayerConnection> find(String gameId, UUID playerId) {
        return Optional.ofNullable(connections.get(new ConnectionKey(gameId, playerId)));
    }

    public List<UUID> connectedPlayers(String gameId) {
        return connectionsOf(gameId).stream().map(PlayerConnection::getPlayerId).toList();
    }

    public boolean isConnected(String gameId, UUID playerId) {
        return connections.containsKey(new ConnectionKey(gameId, playerId));
    }

    public int connectionCount() {
        return connections.size();
    }

    /**
     * @return live connection count per game id, sorted by game id
     */
    public Map<String, Integer> connectionsPerGame() {
        Map<String, Integer> perGame = new TreeMap<>();
        gameIndex.forEach((gameId, keys) -> {
            if (!keys.isEmpty()) {
                perGame.put(gameId, keys.size());
            }
        });
        return perGame;
    }

    private List<PlayerConnection> connectionsOf(String gameId) {
        Set<ConnectionKey> keys = gameIndex.get(gameId);
        if (keys == null) {
            return List.of();
        }
        return keys.stream()
                .map(connections::get)
                .filter(Objects::nonNull)
                .toList();
    }

    private boolean deliver(PlayerConnection connection, GameEventDto event) {
        try {
            connection.getTransport().send(event);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Write of {} to player {} in game {} failed: {}",
                    event.type().wireName(), connection.getPlayerName(), connection.getGameId(), e.getMessage());
            return false;
        }
    }

    // index updates run inside compute so they are serialized per game
    private void index(ConnectionKey key) {
        gameIndex.compute(key.gameId(), (gameId, keys) -> {
            Set<ConnectionKey> result = keys != null ? keys : ConcurrentHashMap.newKeySet();
            result.add(key);
            return result;
        });
    }

    private void unindex(ConnectionKey key) {
        gameIndex.computeIfPresent(key.gameId(), (gameId, keys) -> {
            if (!connections.containsKey(key)) {
                keys.remove(key);
            }
            return keys.isEmpty() ? null : keys;
        });
    }

    private void closeQuietly(PlayerConnection connection) {
        try {
            connection.getTransport().close();
        } catch (RuntimeException e) {
            log.debug("Closing transport of session {} failed: {}", connection.getSessionId(), e.getMessage());
        }
    }

    private record ConnectionKey(String gameId, UUID playerId) {}
}
