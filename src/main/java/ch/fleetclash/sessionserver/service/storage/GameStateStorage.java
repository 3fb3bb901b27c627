package ch.fleetclash.sessionserver.service.storage;

import java.util.Optional;

/**
 * Durable storage of game state.
 *
 * <p>The engine calls this only through {@code GamePersistenceService}, which runs every write
 * in the background; implementations may block and may throw.
 */
public interface GameStateStorage {

    /**
     * Stores the latest state of a game, replacing the previous one.
     */
    void save(GameSnapshot snapshot);

    /**
     * @return the latest stored state, empty if the game was never stored
     */
    Optional<GameSnapshot> load(String gameId);

    /**
     * Keeps a labelled point-in-time copy in addition to the latest state.
     *
     * @param reason milestone label, e.g. {@code game_started}
     */
    void snapshot(GameSnapshot snapshot, String reason);

    void delete(String gameId);
}
