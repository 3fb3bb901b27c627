package ch.fleetclash.sessionserver.domain;

import ch.fleetclash.sessionserver.domain.enums.GamePhase;
import ch.fleetclash.sessionserver.exception.InvalidPhaseTransitionException;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory aggregate of one game session.
 *
 * <p>A game holds at most two players in join order, the phase of the state machine, whose turn it is
 * and the winner once finished. It is owned by the {@code GameRegistry} and mutated only by the
 * session engine while holding the game's lock, so this class does no synchronization itself.
 *
 * <p>Phase changes go through {@link #transitionTo(GamePhase, Instant)}, which enforces the
 * transition table defined in {@link GamePhase}.
 */
@Getter
@Setter
public class Game {

    private static final int MAX_HISTORY_ENTRIES = 500;

    private final String id;
    private final GameConfiguration configuration;
    private final Instant createdAt;
    private final Map<UUID, Player> players = new LinkedHashMap<>();
    private final List<GameHistoryEntry> history = new ArrayList<>();

    private GamePhase phase = GamePhase.WAITING;
    private UUID currentTurn;
    private UUID winner;
    private Instant lastActivity;

    /**
     * Incremented each time a turn starts. Used to discard timer callbacks of turns that already ended.
     */
    private int turnNumber;
    private Instant turnStartedAt;

    /**
     * When the current turn times out, {@code null} while no turn timer runs. Kept on the game so the
     * remaining budget can be read under the game lock even while a timer callback is in flight.
     */
    private Instant turnDeadline;

    /**
     * Present iff {@link #phase} is {@link GamePhase#PAUSED}.
     */
    private PauseRecord pauseRecord;

    public Game(String id, GameConfiguration configuration, Instant createdAt) {
        this.id = id;
        this.configuration = configuration;
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
    }

    public List<Player> getPlayers() {
        return List.copyOf(players.values());
    }

    public List<GameHistoryEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public void addPlayer(Player player) {
        players.put(player.getId(), player);
    }

    public Optional<Player> findPlayer(UUID playerId) {
        return Optional.ofNullable(playerId).map(players::get);
    }

    /**
     * @return the other player of a two-player game, empty if the given player is alone or unknown
     */
    public Optional<Player> opponentOf(UUID playerId) {
        return players.values().stream()
                .filter(p -> !p.getId().equals(playerId))
                .findFirst();
    }

    public boolean isFull() {
        return players.size() >= GameConfiguration.MAX_PLAYERS;
    }

    public boolean allPlayersReady() {
        return isFull() && players.values().stream().allMatch(Player::isReady);
    }

    public boolean isPaused() {
        return phase == GamePhase.PAUSED;
    }

    /**
     * Moves the game to another phase.
     *
     * @throws InvalidPhaseTransitionException if the edge is not part of the transition table
     */
    public void transitionTo(GamePhase target, Instant now) {
        if (!phase.canTransitionTo(target)) {
            throw new InvalidPhaseTransitionException(id, phase, target);
        }
        GamePhase from = phase;
        phase = target;
        record("phase_transition", null, now, Map.of("from", from.name(), "to", target.name()));
    }

    /**
     * Hands the turn to the given player and starts a new turn number.
     */
    public void beginTurn(UUID playerId, Instant now) {
        currentTurn = playerId;
        turnNumber++;
        turnStartedAt = now;
    }

    /**
     * Ends the game with the given winner. The turn holder is cleared.
     */
    public void finish(UUID winnerId, Instant now) {
        transitionTo(GamePhase.FINISHED, now);
        winner = winnerId;
        currentTurn = null;
        turnDeadline = null;
    }

    /**
     * @return milliseconds left in the current turn (never negative), {@code null} if no turn timer runs
     */
    public Long remainingTurnMillis(Instant now) {
        if (turnDeadline == null) {
            return null;
        }
        return Math.max(0, Duration.between(now, turnDeadline).toMillis());
    }

    public void pause(PauseRecord record, Instant now) {
        transitionTo(GamePhase.PAUSED, now);
        pauseRecord = record;
    }

    /**
     * Leaves the paused phase.
     *
     * @return the pause record that was active
     */
    public PauseRecord resume(Instant now) {
        transitionTo(GamePhase.PLAYING, now);
        PauseRecord previous = pauseRecord;
        pauseRecord = null;
        return previous;
    }

    public void touch(Instant now) {
        lastActivity = now;
    }

    public void record(String type, UUID playerId, Instant now, Map<String, Object> details) {
        if (history.size() >= MAX_HISTORY_ENTRIES) {
            history.remove(0);
        }
        history.add(new GameHistoryEntry(type, playerId, turnNumber, now, details));
    }
}
