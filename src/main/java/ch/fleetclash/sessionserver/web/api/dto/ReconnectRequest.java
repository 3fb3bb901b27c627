package ch.fleetclash.sessionserver.web.api.dto;

import java.util.UUID;

public record ReconnectRequest(
        UUID playerId,
        String reconnectionToken
) {}
