package ch.fleetclash.sessionserver.exception;

import ch.fleetclash.sessionserver.domain.enums.GamePhase;
import lombok.Getter;

/**
 * Raised when a phase change outside the transition table is attempted.
 */
@Getter
public class InvalidPhaseTransitionException extends StateConflictException {

    private final GamePhase from;
    private final GamePhase to;

    public InvalidPhaseTransitionException(String gameId, GamePhase from, GamePhase to) {
        super("invalid_transition", "Game " + gameId + " cannot move from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }
}
