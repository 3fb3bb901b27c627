package ch.fleetclash.sessionserver.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.UUID;

/**
 * Reconnection window of a player whose connection dropped.
 *
 * <p>At most one live session exists per (game, player). It is removed when the token is redeemed
 * or when it expires.
 */
public record DisconnectedSession(
        String gameId,
        UUID playerId,
        String playerName,
        String sessionId,
        String reconnectionToken,
        Instant disconnectedAt,
        Instant expiresAt
) {
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Constant-time comparison of the presented token.
     */
    public boolean matches(String token) {
        if (token == null) {
            return false;
        }
        return MessageDigest.isEqual(
                reconnectionToken.getBytes(StandardCharsets.UTF_8),
                token.getBytes(StandardCharsets.UTF_8));
    }
}
