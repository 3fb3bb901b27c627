package ch.fleetclash.sessionserver.web.api.dto;

import java.util.UUID;

/**
 * Generic request DTO for player-initiated game actions.
 *
 * <p>Used for endpoints where only the acting player's identity is required (pause, resume).
 *
 * @param playerId identifier of the player performing the action
 */
public record PlayerActionRequest(
        UUID playerId
) {}
