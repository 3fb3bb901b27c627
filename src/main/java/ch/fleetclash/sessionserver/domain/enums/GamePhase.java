package ch.fleetclash.sessionserver.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle phase of a game session.
 *
 * <p>Allowed transitions:
 * <ul>
 *   <li>WAITING → SETUP</li>
 *   <li>SETUP → PLAYING | WAITING</li>
 *   <li>PLAYING → PAUSED | FINISHED</li>
 *   <li>PAUSED → PLAYING</li>
 *   <li>any non-abandoned phase → ABANDONED</li>
 * </ul>
 * FINISHED and ABANDONED are terminal for gameplay.
 */
public enum GamePhase {
    WAITING,
    SETUP,
    PLAYING,
    PAUSED,
    FINISHED,
    ABANDONED;

    /**
     * Checks whether a transition from this phase to {@code target} is part of the transition table.
     *
     * @param target requested phase
     * @return {@code true} if the edge exists
     */
    public boolean canTransitionTo(GamePhase target) {
        if (target == ABANDONED) {
            return this != ABANDONED;
        }
        return successors().contains(target);
    }

    /**
     * @return {@code true} if no further gameplay happens in this phase
     */
    public boolean isTerminal() {
        return this == FINISHED || this == ABANDONED;
    }

    private Set<GamePhase> successors() {
        return switch (this) {
            case WAITING -> EnumSet.of(SETUP);
            case SETUP -> EnumSet.of(PLAYING, WAITING);
            case PLAYING -> EnumSet.of(PAUSED, FINISHED);
            case PAUSED -> EnumSet.of(PLAYING);
            case FINISHED, ABANDONED -> EnumSet.noneOf(GamePhase.class);
        };
    }
}
