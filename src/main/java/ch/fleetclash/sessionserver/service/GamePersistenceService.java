package ch.fleetclash.sessionserver.service;

import ch.fleetclash.sessionserver.domain.Game;
import ch.fleetclash.sessionserver.service.storage.GameSnapshot;
import ch.fleetclash.sessionserver.service.storage.GameStateStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Fire-and-forget bridge between the session engine and {@link GameStateStorage}.
 *
 * <p>The snapshot is taken synchronously on the calling thread (which holds the game lock),
 * the write itself runs on the persistence executor. Storage failures are logged and never
 * reach the caller of the game operation.
 */
@Service
@Slf4j
public class GamePersistenceService {

    private final GameStateStorage storage;
    private final TaskExecutor persistenceExecutor;

    public GamePersistenceService(GameStateStorage storage,
                                  @Qualifier("persistenceExecutor") TaskExecutor persistenceExecutor) {
        this.storage = storage;
        this.persistenceExecutor = persistenceExecutor;
    }

    /**
     * Schedules a write of the latest game state.
     */
    public void save(Game game) {
        GameSnapshot snapshot = GameSnapshot.of(game);
        dispatch(snapshot.gameId(), "save", () -> storage.save(snapshot));
    }

    /**
     * Schedules a write of the latest state plus a labelled milestone copy.
     */
    public void snapshot(Game game, String reason) {
        GameSnapshot snapshot = GameSnapshot.of(game);
        dispatch(snapshot.gameId(), reason, () -> {
            storage.save(snapshot);
            storage.snapshot(snapshot, reason);
        });
    }

    /**
     * Schedules the final write of an abandoned game.
     *
     * @param onStored runs after the write succeeded
     */
    public void archive(Game game, Runnable onStored) {
        GameSnapshot snapshot = GameSnapshot.of(game);
        dispatch(snapshot.gameId(), "archived", () -> {
            storage.save(snapshot);
            storage.snapshot(snapshot, "archived");
            onStored.run();
        });
    }

    /**
     * Schedules removal of all stored state of a game.
     *
     * @param onStored runs after the removal succeeded
     */
    public void delete(String gameId, Runnable onStored) {
        dispatch(gameId, "delete", () -> {
            storage.delete(gameId);
            onStored.run();
        });
    }

    /**
     * Loads and rebuilds a stored game. Runs synchronously because the caller needs the result.
     *
     * @return the restored game, empty if nothing is stored or the stored state cannot be read
     */
    public Optional<Game> restore(String gameId) {
        try {
            return storage.load(gameId).map(GameSnapshot::toGame);
        } catch (RuntimeException e) {
            log.warn("Could not restore game {} from storage: {}", gameId, e.getMessage());
            return Optional.empty();
        }
    }

    private void dispatch(String gameId, String operation, Runnable write) {
        try {
            persistenceExecutor.execute(() -> {
                try {
                    write.run();
                    log.debug("Persisted game {} ({})", gameId, operation);
                } catch (RuntimeException e) {
                    log.warn("Background persistence of game {} failed ({}): {}", gameId, operation, e.getMessage());
                }
            });
        } catch (RuntimeException e) {
            log.warn("Persistence of game {} was rejected ({}): {}", gameId, operation, e.getMessage());
        }
    }
}
