package ch.fleetclash.sessionserver.exception;

import java.util.UUID;

/**
 * Raised when a game or a player inside a game does not exist.
 */
public class GameNotFoundException extends GameException {

    private GameNotFoundException(String reason, String message) {
        super(ErrorCategory.NOT_FOUND, reason, message);
    }

    public static GameNotFoundException game(String gameId) {
        return new GameNotFoundException("game_not_found", "Game not found: " + gameId);
    }

    public static GameNotFoundException player(String gameId, UUID playerId) {
        return new GameNotFoundException("player_not_found",
                "Player " + playerId + " is not part of game " + gameId);
    }
}
