package ch.fleetclash.sessionserver.exception;

/**
 * Raised when a reconnection token is unknown, does not match, was already redeemed or has expired.
 */
public class ExpiredCredentialException extends GameException {

    public ExpiredCredentialException(String message) {
        super(ErrorCategory.EXPIRED_CREDENTIAL, "invalid_or_expired_token", message);
    }
}
