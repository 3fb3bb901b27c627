package ch.fleetclash.sessionserver.exception;

/**
 * Raised when a player cannot be added to a game (game full, name already taken).
 */
public class CapacityException extends GameException {

    public CapacityException(String reason, String message) {
        super(ErrorCategory.CAPACITY, reason, message);
    }
}
