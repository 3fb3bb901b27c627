package ch.fleetclash.sessionserver.service;

import ch.fleetclash.sessionserver.domain.Coordinate;
import ch.fleetclash.sessionserver.domain.Game;
import ch.fleetclash.sessionserver.domain.GameConfiguration;
import ch.fleetclash.sessionserver.domain.PauseRecord;
import ch.fleetclash.sessionserver.domain.Player;
import ch.fleetclash.sessionserver.domain.Ship;
import ch.fleetclash.sessionserver.domain.ShipPlacement;
import ch.fleetclash.sessionserver.domain.enums.GamePhase;
import ch.fleetclash.sessionserver.domain.enums.PauseReason;
import ch.fleetclash.sessionserver.domain.enums.ShotResult;
import ch.fleetclash.sessionserver.exception.CapacityException;
import ch.fleetclash.sessionserver.exception.GameNotFoundException;
import ch.fleetclash.sessionserver.exception.StateConflictException;
import ch.fleetclash.sessionserver.exception.ValidationException;
import ch.fleetclash.sessionserver.service.signal.PlayerDisconnectedSignal;
import ch.fleetclash.sessionserver.service.signal.PlayerReconnectedSignal;
import ch.fleetclash.sessionserver.web.api.dto.AttackResultDto;
import ch.fleetclash.sessionserver.web.api.dto.GameEventDto;
import ch.fleetclash.sessionserver.web.api.dto.GameViewDto;
import ch.fleetclash.sessionserver.web.api.dto.JoinGameResponseDto;
import ch.fleetclash.sessionserver.web.api.dto.ShipDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Authoritative game logic: phase state machine, ship placement, turn flow and attack resolution.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Create games, let a second player join and accept each player's fleet</li>
 *   <li>Start the game with a random first player once both fleets are placed</li>
 *   <li>Resolve attacks, alternate turns and detect the winner</li>
 *   <li>Pause and resume, manually or driven by disconnect/reconnect signals</li>
 *   <li>Forfeit the current turn when the turn timer expires</li>
 * </ul>
 *
 * <p><b>Concurrency:</b> every operation reads, validates and mutates a game inside
 * {@link GameRegistry#withLock(String, java.util.function.Supplier)}, so user actions, timer callbacks
 * and connection signals for the same game are serialized. Events are published to the
 * {@link ConnectionHub} while the lock is still held, which keeps their order per connection equal to
 * the order of the mutations. Persistence is handed off to {@link GamePersistenceService} and never
 * delays the response.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameSessionEngine {

    private final GameRegistry registry;
    private final FleetValidator fleetValidator;
    private final TurnClock turnClock;
    private final ConnectionHub connectionHub;
    private final ReconnectionManager reconnectionManager;
    private final GamePersistenceService persistence;
    private final GameIntegrityChecker integrityChecker;
    private final GameConfiguration gameConfiguration;
    private final Clock clock;

    // ------------------------------------------------------------------------------------
    // Lobby
    // ------------------------------------------------------------------------------------

    /**
     * Opens a new game in {@link GamePhase#WAITING} with the host as first player.
     *
     * @param hostName display name of the host
     * @return identifiers of the new game and of the host
     */
    public JoinGameResponseDto createSession(String hostName) {
        String name = requireName(hostName);
        Instant now = clock.instant();

        Game game = new Game(UUID.randomUUID().toString(), gameConfiguration, now);
        Player host = new Player(name, gameConfiguration.getBoardSize());
        game.addPlayer(host);
        game.record("game_created", host.getId(), now, Map.of("hostName", name));

        registry.insert(game);
        persistence.snapshot(game, "game_created");

        log.info("Game {} created by {}", game.getId(), name);
        return joinResponse(game, host);
    }

    /**
     * Adds a second player to a waiting game.
     *
     * @throws GameNotFoundException   if the game does not exist
     * @throws StateConflictException  if the game is no longer waiting for players
     * @throws CapacityException       if the game is full or the name is already taken (case-insensitive)
     */
    public JoinGameResponseDto join(String gameId, String playerName) {
        return registry.withLock(gameId, () -> {
            Game game = requireGame(gameId);
            String name = requireName(playerName);

            if (game.getPhase() != GamePhase.WAITING) {
                throw new StateConflictException("game_not_joinable",
                        "Game " + gameId + " cannot be joined in phase " + game.getPhase());
            }
            if (game.isFull()) {
                throw new CapacityException("game_full", "Game " + gameId + " already has two players");
            }
            if (game.getPlayers().stream().anyMatch(p -> p.hasName(name))) {
                throw new CapacityException("duplicate_name", "Name '" + name + "' is already taken in this game");
            }

            Instant now = clock.instant();
            Player player = new Player(name, game.getConfiguration().getBoardSize());
            game.addPlayer(player);
            game.record("player_joined", player.getId(), now, Map.of("playerName", name));
            game.touch(now);

            log.info("Player {} joined game {}", name, gameId);
            connectionHub.publish(gameId, GameEventDto.playerJoined(game, player, now), player.getId());
            persistence.save(game);
            return joinResponse(game, player);
        });
    }

    // ------------------------------------------------------------------------------------
    // Setup
    // ------------------------------------------------------------------------------------

    /**
     * Accepts the fleet of a player.
     *
     * <p>The first accepted fleet moves the game from WAITING to SETUP. When both players have
     * placed their fleets the game starts: a random player gets the first turn and the turn timer
     * is armed.
     *
     * @throws StateConflictException if the game is past setup or the player already placed ships
     * @throws ch.fleetclash.sessionserver.exception.FleetValidationException if the fleet breaks a rule
     */
    public GameViewDto placeShips(String gameId, UUID playerId, List<ShipPlacement> placements) {
        return registry.withLock(gameId, () -> {
            Game game = requireGame(gameId);
            if (game.getPhase() != GamePhase.WAITING && game.getPhase() != GamePhase.SETUP) {
                throw new StateConflictException("invalid_phase",
                        "Ships cannot be placed in phase " + game.getPhase());
            }
            Player player = requirePlayer(game, playerId);
            if (player.hasShipsPlaced()) {
                throw new StateConflictException("ships_already_placed",
                        "Player " + player.getName() + " already placed ships");
            }

            List<Ship> ships = fleetValidator.validate(placements, game.getConfiguration());

            Instant now = clock.instant();
            player.placeFleet(ships);
            if (game.getPhase() == GamePhase.WAITING) {
                game.transitionTo(GamePhase.SETUP, now);
            }
            game.record("ships_placed", playerId, now, Map.of("ships", ships.size()));
            game.touch(now);

            boolean allReady = game.allPlayersReady();
            log.info("Player {} placed {} ships in game {}", player.getName(), ships.size(), gameId);
            connectionHub.publish(gameId, GameEventDto.shipsPlaced(game, player, allReady, now), playerId);

            if (allReady) {
                startGame(game, now);
            } else {
                persistence.save(game);
            }
            return view(game, player);
        });
    }

    private void startGame(Game game, Instant now) {
        game.transitionTo(GamePhase.PLAYING, now);
        List<Player> players = game.getPlayers();
        Player first = players.get(ThreadLocalRandom.current().nextInt(players.size()));
        startTurn(game, first.getId(), now);

        log.info("Game {} started, {} begins", game.getId(), first.getName());
        connectionHub.publish(game.getId(), GameEventDto.gameStarted(game, first, now));
        persistence.snapshot(game, "game_started");
    }

    // ------------------------------------------------------------------------------------
    // Playing
    // ------------------------------------------------------------------------------------

    /**
     * Resolves an attack of the current turn holder on the opponent's board.
     *
     * <p>A miss or a hit passes the turn to the opponent and re-arms the turn timer. Sinking the
     * last ship finishes the game with the attacker as winner.
     *
     * @param rawPosition target cell in board notation, e.g. {@code "A1"}
     * @throws StateConflictException if the game is not playing, is paused or it is not the attacker's turn
     * @throws ValidationException    if the position is malformed, off the board or already attacked
     */
    public AttackResultDto attack(String gameId, UUID attackerId, String rawPosition) {
        return registry.withLock(gameId, () -> {
            Game game = requireGame(gameId);
            if (game.isPaused()) {
                throw new StateConflictException("game_paused", "Game " + gameId + " is paused");
            }
            if (game.getPhase() != GamePhase.PLAYING) {
                throw new StateConflictException("invalid_phase",
                        "Attacks are not allowed in phase " + game.getPhase());
            }
            Player attacker = requirePlayer(game, attackerId);
            if (!attackerId.equals(game.getCurrentTurn())) {
                throw new StateConflictException("not_your_turn", "It is not " + attacker.getName() + "'s turn");
            }

            Coordinate position = Coordinate.parse(rawPosition);
            int boardSize = game.getConfiguration().getBoardSize();
            if (!position.isWithin(boardSize)) {
                throw new ValidationException("position_out_of_bounds",
                        position + " is outside the " + boardSize + "x" + boardSize + " board");
            }

            Player target = game.opponentOf(attackerId)
                    .orElseThrow(() -> new StateConflictException("no_opponent", "Game has no opponent"));
            if (target.getBoard().isAttacked(position)) {
                throw new ValidationException("already_attacked", position + " was already attacked");
            }

            Instant now = clock.instant();
            Optional<Ship> struck = target.shipAt(position);
            ShotResult result;
            Ship sunkShip = null;
            if (struck.isPresent()) {
                Ship ship = struck.get();
                boolean sank = ship.registerHit();
                target.getBoard().recordHit(position);
                result = sank ? ShotResult.SUNK : ShotResult.HIT;
                sunkShip = sank ? ship : null;
            } else {
                target.getBoard().recordMiss(position);
                result = ShotResult.MISS;
            }
            game.record("attack", attackerId, now, Map.of("position", position.toString(), "result", result.name()));
            game.touch(now);

            boolean gameOver = target.isFleetDestroyed();
            if (gameOver) {
                turnClock.stop(gameId);
                game.finish(attackerId, now);
            } else {
                startTurn(game, target.getId(), now);
            }
            Player next = gameOver ? null : target;

            connectionHub.publish(gameId,
                    GameEventDto.attackMade(game, attacker, target, position, result, sunkShip, next, now), attackerId);

            if (gameOver) {
                log.info("Game {} finished, winner {}", gameId, attacker.getName());
                connectionHub.publish(gameId, GameEventDto.gameFinished(game, attacker, target, now));
                persistence.snapshot(game, "game_finished");
            } else {
                persistence.save(game);
            }

            return new AttackResultDto(
                    result,
                    position.toString(),
                    sunkShip == null ? null : ShipDto.from(sunkShip),
                    game.getCurrentTurn(),
                    gameOver,
                    game.getWinner(),
                    game.getPhase()
            );
        });
    }

    /**
     * Called by the {@link TurnClock} when a turn runs out. The turn passes to the opponent with a
     * fresh full timer; the game itself continues.
     *
     * <p>Callbacks that no longer match the game (turn already over, game paused, finished or
     * removed) are ignored.
     */
    public void handleTurnTimeout(String gameId, UUID playerId, int turnNumber) {
        registry.runLocked(gameId, () -> {
            Game game = registry.find(gameId).orElse(null);
            if (game == null
                    || game.getPhase() != GamePhase.PLAYING
                    || !playerId.equals(game.getCurrentTurn())
                    || game.getTurnNumber() != turnNumber) {
                log.debug("Ignoring stale turn timeout of game {} (turn {})", gameId, turnNumber);
                return;
            }

            Instant now = clock.instant();
            Player timedOut = requirePlayer(game, playerId);
            Player next = game.opponentOf(playerId).orElse(timedOut);

            game.record("turn_timeout", playerId, now, Map.of("turnNumber", turnNumber));
            startTurn(game, next.getId(), now);

            log.info("Turn {} of {} in game {} timed out, {} continues",
                    turnNumber, timedOut.getName(), gameId, next.getName());
            connectionHub.publish(gameId, GameEventDto.turnTimeout(game, timedOut, next, turnNumber, now));
            persistence.save(game);
        });
    }

    // ------------------------------------------------------------------------------------
    // Pause / resume
    // ------------------------------------------------------------------------------------

    /**
     * Pauses a playing game. Does nothing in any other phase.
     *
     * @param byPlayerId player causing the pause, may be {@code null}
     * @return {@code true} if the game was paused by this call
     */
    public boolean pause(String gameId, PauseReason reason, UUID byPlayerId) {
        return registry.withLock(gameId, () -> {
            Game game = requireGame(gameId);
            Player by = byPlayerId == null ? null : requirePlayer(game, byPlayerId);
            return pauseLocked(game, reason, by);
        });
    }

    /**
     * Manual pause requested by a player. Unlike {@link #pause(String, PauseReason, UUID)} this
     * reports a conflict when the game cannot be paused.
     *
     * @throws StateConflictException if the game is already paused or not playing
     */
    public void requestPause(String gameId, UUID playerId) {
        registry.runLocked(gameId, () -> {
            Game game = requireGame(gameId);
            Player by = requirePlayer(game, playerId);
            if (game.isPaused()) {
                throw new StateConflictException("already_paused", "Game " + gameId + " is already paused");
            }
            if (!pauseLocked(game, PauseReason.MANUAL, by)) {
                throw new StateConflictException("invalid_phase",
                        "Game cannot be paused in phase " + game.getPhase());
            }
        });
    }

    /**
     * Resumes a paused game. The turn timer continues with the time that was left when the game
     * was paused.
     *
     * @param byPlayerId player resuming the game, may be {@code null}
     * @throws StateConflictException if the game is not paused
     */
    public void resume(String gameId, UUID byPlayerId) {
        registry.runLocked(gameId, () -> {
            Game game = requireGame(gameId);
            if (byPlayerId != null) {
                requirePlayer(game, byPlayerId);
            }
            if (!game.isPaused()) {
                throw new StateConflictException("not_paused", "Game " + gameId + " is not paused");
            }
            resumeLocked(game, "manual");
        });
    }

    /**
     * Pauses the game if the disconnected player holds the turn. An idle player's disconnect leaves
     * the game running.
     */
    @EventListener
    public void onPlayerDisconnected(PlayerDisconnectedSignal signal) {
        registry.runLocked(signal.gameId(), () -> {
            Game game = registry.find(signal.gameId()).orElse(null);
            if (game == null) {
                log.debug("Disconnect signal for unknown game {}", signal.gameId());
                return;
            }
            if (game.getPhase() == GamePhase.PLAYING && signal.playerId().equals(game.getCurrentTurn())) {
                pauseLocked(game, PauseReason.DISCONNECT, game.findPlayer(signal.playerId()).orElse(null));
            } else {
                log.info("Player {} disconnected from game {} without holding the turn, game continues in {}",
                        signal.playerId(), game.getId(), game.getPhase());
            }
        });
    }

    /**
     * Resumes the game if it was paused because this very player disconnected.
     */
    @EventListener
    public void onPlayerReconnected(PlayerReconnectedSignal signal) {
        registry.runLocked(signal.gameId(), () -> {
            Game game = registry.find(signal.gameId()).orElse(null);
            if (game == null) {
                log.debug("Reconnect signal for unknown game {}", signal.gameId());
                return;
            }
            PauseRecord pause = game.getPauseRecord();
            if (game.isPaused() && pause != null && pause.causedBy(PauseReason.DISCONNECT, signal.playerId())) {
                resumeLocked(game, "reconnect");
            } else {
                log.debug("Reconnect of player {} does not resume game {} ({})",
                        signal.playerId(), game.getId(), game.getPhase());
            }
        });
    }

    private boolean pauseLocked(Game game, PauseReason reason, Player by) {
        if (game.getPhase() != GamePhase.PLAYING) {
            log.debug("Pause of game {} ignored in phase {}", game.getId(), game.getPhase());
            return false;
        }
        Instant now = clock.instant();
        Long remaining = game.remainingTurnMillis(now);
        turnClock.stop(game.getId());
        game.setTurnDeadline(null);

        PauseRecord record = new PauseRecord(
                reason,
                now,
                by == null ? null : by.getId(),
                remaining
        );
        game.pause(record, now);
        game.record("game_paused", record.pausedByPlayerId(), now, Map.of("reason", reason.wireName()));
        game.touch(now);

        log.info("Game {} paused ({}) by {}", game.getId(), reason.wireName(), by == null ? "system" : by.getName());
        connectionHub.publish(game.getId(), GameEventDto.gamePaused(game, record, by, now));
        persistence.save(game);
        return true;
    }

    private void resumeLocked(Game game, String reason) {
        Instant now = clock.instant();
        PauseRecord previous = game.resume(now);
        Long remaining = previous == null ? null : previous.remainingTurnMillis();

        GameConfiguration config = game.getConfiguration();
        if (config.isTurnTimerEnabled()) {
            long budget = remaining != null ? Math.max(1, remaining) : config.getTurnTimeoutMs();
            armTurnTimer(game, budget);
            remaining = budget;
        }
        game.record("game_resumed", null, now, Map.of("reason", reason));
        game.touch(now);

        log.info("Game {} resumed ({})", game.getId(), reason);
        connectionHub.publish(game.getId(), GameEventDto.gameResumed(game, reason, remaining, now));
        persistence.save(game);
    }

    // ------------------------------------------------------------------------------------
    // Queries and lifecycle
    // ------------------------------------------------------------------------------------

    /**
     * @return the game as seen by the given player
     */
    public GameViewDto getView(String gameId, UUID playerId) {
        return registry.withLock(gameId, () -> {
            Game game = requireGame(gameId);
            return view(game, requirePlayer(game, playerId));
        });
    }

    /**
     * Resolves the display name of a player, confirming the player belongs to the game.
     * Used by the transports before subscribing.
     */
    public String requirePlayerName(String gameId, UUID playerId) {
        return registry.withLock(gameId, () -> requirePlayer(requireGame(gameId), playerId).getName());
    }

    /**
     * Abandons a game and removes it from memory: timer stopped, subscribers told and disconnected,
     * reconnection windows discarded, an {@code archived} snapshot written.
     *
     * @return {@code false} if the game was not in memory
     */
    public boolean abandon(String gameId, String reason) {
        return registry.withLock(gameId, () -> {
            Game game = registry.find(gameId).orElse(null);
            if (game == null) {
                return false;
            }
            Instant now = clock.instant();
            turnClock.stop(gameId);
            if (game.getPhase() != GamePhase.ABANDONED) {
                game.transitionTo(GamePhase.ABANDONED, now);
            }
            game.setPauseRecord(null);
            game.setCurrentTurn(null);
            game.setTurnDeadline(null);

            log.info("Game {} abandoned ({})", gameId, reason);
            connectionHub.publish(gameId, GameEventDto.gameAbandoned(game, reason, now));
            registry.retire(gameId);
            persistence.archive(game, () -> registry.clearRetired(gameId));
            release(gameId);
            return true;
        });
    }

    /**
     * Removes a game from memory and storage without a phase change.
     *
     * @throws GameNotFoundException if the game does not exist
     */
    public void deleteGame(String gameId) {
        registry.runLocked(gameId, () -> {
            requireGame(gameId);
            turnClock.stop(gameId);
            registry.retire(gameId);
            release(gameId);
            persistence.delete(gameId, () -> registry.clearRetired(gameId));
            log.info("Game {} deleted", gameId);
        });
    }

    private void release(String gameId) {
        connectionHub.closeGame(gameId);
        reconnectionManager.discardGame(gameId);
        registry.evict(gameId);
    }

    // ------------------------------------------------------------------------------------
    // Helpers (callers hold the game lock)
    // ------------------------------------------------------------------------------------

    private Game requireGame(String gameId) {
        Game game = registry.find(gameId)
                .or(() -> restore(gameId))
                .orElseThrow(() -> GameNotFoundException.game(gameId));
        integrityChecker.verifyAndRepair(game);
        return game;
    }

    private Optional<Game> restore(String gameId) {
        if (gameId == null || registry.isRetired(gameId)) {
            return Optional.empty();
        }
        return persistence.restore(gameId)
                .filter(game -> game.getPhase() != GamePhase.ABANDONED)
                .map(game -> {
                    registry.insert(game);
                    if (game.getPhase() == GamePhase.PLAYING && game.getCurrentTurn() != null
                            && game.getConfiguration().isTurnTimerEnabled()) {
                        armTurnTimer(game, game.getConfiguration().getTurnTimeoutMs());
                    }
                    log.info("Game {} restored from storage in phase {}", gameId, game.getPhase());
                    return game;
                });
    }

    private Player requirePlayer(Game game, UUID playerId) {
        return game.findPlayer(playerId)
                .orElseThrow(() -> GameNotFoundException.player(game.getId(), playerId));
    }

    private void startTurn(Game game, UUID playerId, Instant now) {
        game.beginTurn(playerId, now);
        if (game.getConfiguration().isTurnTimerEnabled()) {
            armTurnTimer(game, game.getConfiguration().getTurnTimeoutMs());
        } else {
            turnClock.stop(game.getId());
            game.setTurnDeadline(null);
        }
    }

    private void armTurnTimer(Game game, long durationMs) {
        String gameId = game.getId();
        UUID holder = game.getCurrentTurn();
        int turnNumber = game.getTurnNumber();
        game.setTurnDeadline(clock.instant().plusMillis(durationMs));
        turnClock.start(gameId, durationMs, () -> handleTurnTimeout(gameId, holder, turnNumber));
    }

    private GameViewDto view(Game game, Player player) {
        return GameViewDto.forPlayer(game, player, game.remainingTurnMillis(clock.instant()));
    }

    private JoinGameResponseDto joinResponse(Game game, Player player) {
        return new JoinGameResponseDto(game.getId(), player.getId(), player.getName(), game.getPhase(),
                game.getPlayers().size());
    }

    private String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("player_name", "Player name must not be blank");
        }
        String trimmed = name.trim();
        if (trimmed.length() > 32) {
            throw new ValidationException("player_name", "Player name must not exceed 32 characters");
        }
        return trimmed;
    }
}
