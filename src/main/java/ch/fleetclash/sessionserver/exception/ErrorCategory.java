package ch.fleetclash.sessionserver.exception;

/**
 * Category of an expected, recoverable failure. Callers may retry with corrected input.
 */
public enum ErrorCategory {
    NOT_FOUND,
    STATE_CONFLICT,
    VALIDATION,
    CAPACITY,
    EXPIRED_CREDENTIAL
}
