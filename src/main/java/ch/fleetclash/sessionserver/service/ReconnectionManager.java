package ch.fleetclash.sessionserver.service;

import ch.fleetclash.sessionserver.domain.DisconnectedSession;
import ch.fleetclash.sessionserver.domain.PlayerConnection;
import ch.fleetclash.sessionserver.exception.ExpiredCredentialException;
import ch.fleetclash.sessionserver.service.signal.PlayerDisconnectedSignal;
import ch.fleetclash.sessionserver.service.signal.PlayerReconnectedSignal;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the reconnection window of disconnected players.
 *
 * <p>On disconnect a single-use token is minted and a {@link DisconnectedSession} is stored for the
 * grace period ({@code realtime.reconnection.grace-period-ms}, default 5 minutes). Redeeming the
 * token removes the session atomically, so a token can be used only once. Expired sessions are
 * dropped by a silent sweep.
 *
 * <p>The session engine is informed through {@link PlayerDisconnectedSignal} and
 * {@link PlayerReconnectedSignal} application events instead of direct calls.
 */
@Service
@Slf4j
public class ReconnectionManager {

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Getter
    private final long gracePeriodMs;

    private final Map<SessionKey, DisconnectedSession> sessions = new ConcurrentHashMap<>();

    public ReconnectionManager(ApplicationEventPublisher eventPublisher,
                               Clock clock,
                               @Value("${realtime.reconnection.grace-period-ms:300000}") long gracePeriodMs) {
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.gracePeriodMs = gracePeriodMs;
    }

    /**
     * Opens the reconnection window for a dropped connection and notifies the engine.
     * A previous window of the same player in the same game is replaced.
     *
     * @return the stored session including the freshly minted token
     */
    public DisconnectedSession recordDisconnect(PlayerConnection connection) {
        Instant now = clock.instant();
        DisconnectedSession session = new DisconnectedSession(
                connection.getGameId(),
                connection.getPlayerId(),
                connection.getPlayerName(),
                connection.getSessionId(),
                UUID.randomUUID().toString(),
                now,
                now.plus(Duration.ofMillis(gracePeriodMs))
        );
        sessions.put(new SessionKey(connection.getGameId(), connection.getPlayerId()), session);

        log.info("Player {} disconnected from game {}, reconnectable until {}",
                connection.getPlayerName(), connection.getGameId(), session.expiresAt());

        eventPublisher.publishEvent(new PlayerDisconnectedSignal(connection.getGameId(), connection.getPlayerId(), now));
        return session;
    }

    /**
     * Redeems a token without notifying the engine. Used by the connection hub, which attaches the
     * new connection first and then calls {@link #notifyReconnected(String, UUID)}.
     *
     * @return the consumed session
     * @throws ExpiredCredentialException if no live session matches the token
     */
    public DisconnectedSession consume(String gameId, UUID playerId, String token) {
        SessionKey key = new SessionKey(gameId, playerId);
        DisconnectedSession session = sessions.get(key);

        if (session == null || !session.matches(token) || session.isExpired(clock.instant())) {
            throw new ExpiredCredentialException("Invalid or expired reconnection token");
        }
        // remove(key, value) makes concurrent redemptions of the same token fail for all but one caller
        if (!sessions.remove(key, session)) {
            throw new ExpiredCredentialException("Reconnection token was already used");
        }
        return session;
    }

    /**
     * Redeems a token and notifies the engine. This is the standalone validation path; the
     * subscribe path goes through the connection hub.
     *
     * @throws ExpiredCredentialException if no live session matches the token
     */
    public DisconnectedSession tryReconnect(String gameId, UUID playerId, String token) {
        DisconnectedSession session = consume(gameId, playerId, token);
        log.info("Player {} reconnected to game {}", session.playerName(), gameId);
        notifyReconnected(gameId, playerId);
        return session;
    }

    public void notifyReconnected(String gameId, UUID playerId) {
        eventPublisher.publishEvent(new PlayerReconnectedSignal(gameId, playerId, clock.instant()));
    }

    /**
     * Checks a token without consuming it.
     */
    public boolean canReconnect(String gameId, UUID playerId, String token) {
        return findSession(gameId, playerId).filter(s -> s.matches(token)).isPresent();
    }

    /**
     * @return the live session of a player, empty if none exists or it has expired
     */
    public Optional<DisconnectedSession> findSession(String gameId, UUID playerId) {
        Instant now = clock.instant();
        return Optional.ofNullable(sessions.get(new SessionKey(gameId, playerId)))
                .filter(s -> !s.isExpired(now));
    }

    public List<DisconnectedSession> disconnectedPlayers(String gameId) {
        Instant now = clock.instant();
        return sessions.values().stream()
                .filter(s -> s.gameId().equals(gameId))
                .filter(s -> !s.isExpired(now))
                .sorted(Comparator.comparing(DisconnectedSession::disconnectedAt))
                .toList();
    }

    /**
     * Drops every session of a game, e.g. when the game is abandoned or deleted.
     */
    public int discardGame(String gameId) {
        List<SessionKey> keys = sessions.keySet().stream()
                .filter(k -> k.gameId().equals(gameId))
                .toList();
        keys.forEach(sessions::remove);
        return keys.size();
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Scheduled expiry sweep, every {@code realtime.reconnection.sweep-interval-ms} (default 2 minutes).
     */
    @Scheduled(fixedRateString = "${realtime.reconnection.sweep-interval-ms:120000}")
    public void purgeExpiredSessions() {
        sweepExpired();
    }

    /**
     * Deletes expired sessions. Nobody is notified: an expired player is simply no longer reconnectable.
     *
     * @return number of removed sessions
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<SessionKey, DisconnectedSession> entry : sessions.entrySet()) {
            if (entry.getValue().isExpired(now) && sessions.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} expired reconnection session(s)", removed);
        } else {
            log.debug("No expired reconnection sessions");
        }
        return removed;
    }

    private record SessionKey(String gameId, UUID playerId) {
        private SessionKey {
            Objects.requireNonNull(gameId, "gameId");
            Objects.requireNonNull(playerId, "playerId");
        }
    }
}
