package ch.fleetclash.sessionserver.service.signal;

import java.time.Instant;
import java.util.UUID;

/**
 * Published by the connection layer when a player's push channel is gone.
 * Consumed by the session engine, which may pause the game.
 */
public record PlayerDisconnectedSignal(
        String gameId,
        UUID playerId,
        Instant occurredAt
) {}
