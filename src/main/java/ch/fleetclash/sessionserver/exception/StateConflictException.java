package ch.fleetclash.sessionserver.exception;

/**
 * Raised when an operation is not allowed in the current state of a game
 * (wrong phase, not your turn, already placed, not paused).
 */
public class StateConflictException extends GameException {

    public StateConflictException(String reason, String message) {
        super(ErrorCategory.STATE_CONFLICT, reason, message);
    }
}
