package ch.fleetclash.sessionserver.service.signal;

import java.time.Instant;
import java.util.UUID;

/**
 * Published by the connection layer after a reconnection token was redeemed.
 * Consumed by the session engine, which may resume the game.
 */
public record PlayerReconnectedSignal(
        String gameId,
        UUID playerId,
        Instant occurredAt
) {}
