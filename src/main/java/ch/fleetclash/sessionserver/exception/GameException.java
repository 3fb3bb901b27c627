package ch.fleetclash.sessionserver.exception;

import lombok.Getter;

/**
 * Base class of all expected failures raised by the session engine and the connection layer.
 *
 * <p>Each exception carries an {@link ErrorCategory} and a short machine-readable reason code
 * (e.g. {@code not_your_turn}) so the web layer can build a structured error response.
 */
@Getter
public abstract class GameException extends RuntimeException {

    private final ErrorCategory category;
    private final String reason;

    protected GameException(ErrorCategory category, String reason, String message) {
        super(message);
        this.category = category;
        this.reason = reason;
    }
}
