package ch.fleetclash.sessionserver.web.api.dto;

import java.util.UUID;

public record ReconnectResponseDto(
        String gameId,
        UUID playerId,
        String sessionId
) {}
