package ch.fleetclash.sessionserver.service;

import ch.fleetclash.sessionserver.domain.Game;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory store of active games.
 *
 * <p>Besides lookup, insert and evict it hands out one {@link ReentrantLock} per game id.
 * Every read-validate-mutate sequence on a game runs inside {@link #withLock(String, Supplier)},
 * so two requests for the same game never interleave while games stay independent of each other.
 * The lock is reentrant because a mutation may trigger a nested signal for the same game on the
 * same thread (a failed write during fan-out evicts a connection, which notifies the engine).
 *
 * <p>Deleted and abandoned games are marked retired until their final storage write has run, so a
 * request arriving in between cannot bring the old stored state back.
 */
@Component
public class GameRegistry {

    private final Map<String, Game> games = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<String> retired = ConcurrentHashMap.newKeySet();

    public Optional<Game> find(String gameId) {
        return Optional.ofNullable(gameId).map(games::get);
    }

    public Game insert(Game game) {
        games.put(game.getId(), game);
        return game;
    }

    /**
     * Removes a game and its lock. Callers should hold the game's lock; threads already waiting
     * on it will find the game gone.
     */
    public boolean evict(String gameId) {
        locks.remove(gameId);
        return games.remove(gameId) != null;
    }

    /**
     * Marks a game as gone for good. Stored state of a retired game must not be restored.
     */
    public void retire(String gameId) {
        retired.add(gameId);
    }

    public boolean isRetired(String gameId) {
        return retired.contains(gameId);
    }

    /**
     * Called once storage reflects the deletion or the archived state.
     */
    public void clearRetired(String gameId) {
        retired.remove(gameId);
    }

    public List<Game> all() {
        return List.copyOf(games.values());
    }

    public int size() {
        return games.size();
    }

    /**
     * Runs the action while holding the lock of the given game.
     */
    public <T> T withLock(String gameId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(gameId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(String gameId, Runnable action) {
        withLock(gameId, () -> {
            action.run();
            return null;
        });
    }
}
