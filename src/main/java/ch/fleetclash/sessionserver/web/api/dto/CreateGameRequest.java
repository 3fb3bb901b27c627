package ch.fleetclash.sessionserver.web.api.dto;

/**
 * Request DTO to open a new game.
 *
 * @param hostName display name of the creating player, who joins automatically
 */
public record CreateGameRequest(
        String hostName
) {}
