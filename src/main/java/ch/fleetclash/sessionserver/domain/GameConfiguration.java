package ch.fleetclash.sessionserver.domain;

import lombok.Getter;

import java.util.List;

/**
 * Immutable rule set a game is played with.
 *
 * <p>Captured once when the game is created, so changing the application configuration
 * does not affect games that are already running.
 */
@Getter
public final class GameConfiguration {

    public static final int MAX_PLAYERS = 2;
    public static final int MAX_BOARD_SIZE = 26;

    private final int boardSize;
    private final List<Integer> fleet;
    private final boolean allowAdjacent;

    /**
     * Turn timeout in milliseconds; {@code 0} disables the turn timer.
     */
    private final long turnTimeoutMs;

    public GameConfiguration(int boardSize, List<Integer> fleet, boolean allowAdjacent, long turnTimeoutMs) {
        if (boardSize < 1 || boardSize > MAX_BOARD_SIZE) {
            throw new IllegalArgumentException("Board size must be between 1 and " + MAX_BOARD_SIZE);
        }
        if (fleet == null || fleet.isEmpty() || fleet.stream().anyMatch(len -> len < 1 || len > boardSize)) {
            throw new IllegalArgumentException("Fleet must contain ship lengths between 1 and " + boardSize);
        }
        if (turnTimeoutMs < 0) {
            throw new IllegalArgumentException("Turn timeout must not be negative");
        }
        this.boardSize = boardSize;
        this.fleet = List.copyOf(fleet);
        this.allowAdjacent = allowAdjacent;
        this.turnTimeoutMs = turnTimeoutMs;
    }

    /**
     * Classic setup: 10x10 board, fleet 5,4,3,3,2, no touching ships, 60 second turns.
     */
    public static GameConfiguration defaultConfig() {
        return new GameConfiguration(10, List.of(5, 4, 3, 3, 2), false, 60_000);
    }

    public boolean isTurnTimerEnabled() {
        return turnTimeoutMs > 0;
    }
}
