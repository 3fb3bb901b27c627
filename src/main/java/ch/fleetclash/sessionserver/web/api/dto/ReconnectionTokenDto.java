package ch.fleetclash.sessionserver.web.api.dto;

import java.time.Instant;
import java.util.UUID;

public record ReconnectionTokenDto(
        String gameId,
        UUID playerId,
        String reconnectionToken,
        Instant expiresAt
) {}
