package ch.fleetclash.sessionserver.domain;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Entry of the in-memory turn history (phase changes, attacks, pauses, timeouts).
 */
public record GameHistoryEntry(
        String type,
        UUID playerId,
        int turnNumber,
        Instant occurredAt,
        Map<String, Object> details
) {}
