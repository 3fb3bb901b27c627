package ch.fleetclash.sessionserver.exception;

/**
 * Raised for malformed or rejected input (bad coordinate, coordinate already attacked).
 */
public class ValidationException extends GameException {

    public ValidationException(String reason, String message) {
        super(ErrorCategory.VALIDATION, reason, message);
    }
}
