package ch.fleetclash.sessionserver.application.service;

import ch.fleetclash.sessionserver.domain.AnchoredPlacement;
import ch.fleetclash.sessionserver.domain.Game;
import ch.fleetclash.sessionserver.domain.GameConfiguration;
import ch.fleetclash.sessionserver.domain.ShipPlacement;
import ch.fleetclash.sessionserver.domain.enums.GameEventType;
import ch.fleetclash.sessionserver.domain.enums.GamePhase;
import ch.fleetclash.sessionserver.domain.enums.Orientation;
import ch.fleetclash.sessionserver.domain.enums.ShotResult;
import ch.fleetclash.sessionserver.exception.CapacityException;
import ch.fleetclash.sessionserver.exception.FleetValidationException;
import ch.fleetclash.sessionserver.exception.GameException;
import ch.fleetclash.sessionserver.exception.GameNotFoundException;
import ch.fleetclash.sessionserver.exception.StateConflictException;
import ch.fleetclash.sessionserver.exception.ValidationException;
import ch.fleetclash.sessionserver.service.ConnectionHub;
import ch.fleetclash.sessionserver.service.FleetValidator;
import ch.fleetclash.sessionserver.service.GameIntegrityChecker;
import ch.fleetclash.sessionserver.service.GamePersistenceService;
import ch.fleetclash.sessionserver.service.GameRegistry;
import ch.fleetclash.sessionserver.service.GameSessionEngine;
import ch.fleetclash.sessionserver.service.ReconnectionManager;
import ch.fleetclash.sessionserver.service.TurnClock;
import ch.fleetclash.sessionserver.testutil.MutableClock;
import ch.fleetclash.sessionserver.web.api.dto.AttackResultDto;
import ch.fleetclash.sessionserver.web.api.dto.GameEventDto;
import ch.fleetclash.sessionserver.web.api.dto.GameViewDto;
import ch.fleetclash.sessionserver.web.api.dto.JoinGameResponseDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for the lobby, setup and attack flow of {@link GameSessionEngine}.
 *
 * <p>The game rules use a 5x5 board with a single ship of length 2 so a game can be won in
 * two hits. Registry, fleet validator and integrity checker are real; timer, hub, reconnection
 * manager and persistence are mocked.
 */
@ExtendWith(MockitoExtension.class)
class GameSessionEngineTest {

    private static final GameConfiguration RULES = new GameConfiguration(5, List.of(2), false, 60_000);

    @Mock private TurnClock turnClock;
    @Mock private ConnectionHub connectionHub;
    @Mock private ReconnectionManager reconnectionManager;
    @Mock private GamePersistenceService persistence;

    private GameRegistry registry;
    private GameSessionEngine engine;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T12:00:00Z");
        registry = new GameRegistry();
        engine = new GameSessionEngine(
                registry,
                new FleetValidator(),
                turnClock,
                connectionHub,
                reconnectionManager,
                persistence,
                new GameIntegrityChecker(clock),
                RULES,
                clock
        );
    }

    private static List<ShipPlacement> fleetAt(String start) {
        return List.of(new AnchoredPlacement(2, start, Orientation.HORIZONTAL));
    }

    private Game game(String gameId) {
        return registry.find(gameId).orElseThrow();
    }

    /**
     * Creates a game with Alice and Bob, both fleets on A1-A2, and returns it in PLAYING.
     */
    private Game startedGame() {
        JoinGameResponseDto host = engine.createSession("Alice");
        JoinGameResponseDto guest = engine.join(host.gameId(), "Bob");
        engine.placeShips(host.gameId(), host.playerId(), fleetAt("A1"));
        engine.placeShips(host.gameId(), guest.playerId(), fleetAt("A1"));
        return game(host.gameId());
    }

    private UUID currentPlayer(Game game) {
        return game.getCurrentTurn();
    }

    private UUID idlePlayer(Game game) {
        return game.opponentOf(game.getCurrentTurn()).orElseThrow().getId();
    }

    // ------------------------------------------------------------------------------------
    // createSession / join
    // ------------------------------------------------------------------------------------

    @Test
    void createSession_shouldOpenWaitingGame_withHostAsFirstPlayer() {
        // Act
        JoinGameResponseDto response = engine.createSession("  Alice ");

        // Assert
        assertThat(response.phase()).isEqualTo(GamePhase.WAITING);
        assertThat(response.playerName()).isEqualTo("Alice");
        assertThat(response.playerCount()).isEqualTo(1);
        assertThat(game(response.gameId()).getPlayers()).extracting("id").containsExactly(response.playerId());
        verify(persistence).snapshot(any(Game.class), eq("game_created"));
    }

    @Test
    void createSession_shouldRejectBlankName() {
        assertThatThrownBy(() -> engine.createSession("   "))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((GameException) e).getReason())
                .isEqualTo("player_name");
        assertThat(registry.size()).isZero();
    }

    @Test
    void join_shouldAddSecondPlayer_andNotifyOthers() {
        // Arrange
        JoinGameResponseDto host = engine.createSession("Alice");

        // Act
        JoinGameResponseDto guest = engine.join(host.gameId(), "Bob");

        // Assert
        assertThat(guest.playerCount()).isEqualTo(2);
        assertThat(guest.phase()).isEqualTo(GamePhase.WAITING);

        ArgumentCaptor<GameEventDto> captor = ArgumentCaptor.forClass(GameEventDto.class);
        verify(connectionHub).publish(eq(host.gameId()), captor.capture(), eq(guest.playerId()));
        assertThat(captor.getValue().type()).isEqualTo(GameEventType.PLAYER_JOINED);
        assertThat(captor.getValue().payload()).containsEntry("playerName", "Bob");
    }

    @Test
    void join_shouldRejectDuplicateName_caseInsensitive() {
        // Arrange
        JoinGameResponseDto host = engine.createSession("Alice");

        // Act + Assert
        assertThatThrownBy(() -> engine.join(host.gameId(), "ALICE"))
                .isInstanceOf(CapacityException.class)
                .extracting(e -> ((GameException) e).getReason())
                .isEqualTo("duplicate_name");
    }

    @Test
    void join_shouldRejectThirdPlayer() {
        // Arrange
        JoinGameResponseDto host = engine.createSession("Alice");
        engine.join(host.gameId(), "Bob");

        // Act + Assert
        assertThatThrownBy(() -> engine.join(host.gameId(), "Carol"))
                .isInstanceOf(CapacityException.class)
                .extracting(e -> ((GameException) e).getReason())
                .isEqualTo("game_full");
    }

    @Test
    void join_shouldRejectUnknownGame() {
        assertThatThrownBy(() -> engine.join("missing", "Bob"))
                .isInstanceOf(GameNotFoundException.class);
    }

    @Test
    void join_shouldReject_whenSetupAlreadyStarted() {
        // Arrange
        JoinGameResponseDto host = engine.createSession("Alice");
        engine.placeShips(host.gameId(), host.playerId(), fleetAt("A1"));

        // Act + Assert
        assertThatThrownBy(() -> engine.join(host.gameId(), "Bob"))
                .isInstanceOf(StateConflictException.class)
                .extracting(e -> ((GameException) e).getReason())
                .isEqualTo("game_not_joinable");
    }

    // ------------------------------------------------------------------------------------
    // placeShips
    // ------------------------------------------------------------------------------------

    @Test
    void placeShips_shouldMoveToSetup_whenFirstFleetArrives() {
        // Arrange
        JoinGameResponseDto host = engine.createSession("Alice");
        engine.join(host.gameId(), "Bob");

        // Act
        GameViewDto view = engine.placeShips(host.gameId(), host.playerId(), fleetAt("B2"));

        // Assert
        assertThat(view.phase()).isEqualTo(GamePhase.SETUP);
        assertThat(view.ready()).isTrue();
        assertThat(view.ships()).hasSize(1);
        verify(turnClock, never()).start(any(), anyLong(), any());
    }

    @Test
    void placeShips_shouldStartGame_andArmTurnTimer_whenBothFleetsPlaced() {
        // Act
        Game game = startedGame();

        // Assert
        assertThat(game.getPhase()).isEqualTo(GamePhase.PLAYING);
        assertThat(game.getCurrentTurn()).isIn(game.getPlayers().get(0).getId(), game.getPlayers().get(1).getId());
        assertThat(game.getTurnNumber()).isEqualTo(1);
        verify(turnClock).start(eq(game.getId()), eq(60_000L), any(Runnable.class));
        verify(persistence).snapshot(any(Game.class), eq("game_started"));

        ArgumentCaptor<GameEventDto> captor = ArgumentCaptor.forClass(GameEventDto.class);
        verify(connectionHub).publish(eq(game.getId()), captor.capture());
        assertThat(captor.getValue().type()).isEqualTo(GameEventType.GAME_STARTED);
        assertThat(captor.getValue().payload()).containsEntry("currentTurn", game.getCurrentTurn());
    }

    @Test
    void placeShips_shouldRejectSecondPlacement_ofSamePlayer() {
        // Arrange
        JoinGameResponseDto host = engine.createSession("Alice");
        engine.placeShips(host.gameId(), host.playerId(), fleetAt("A1"));

        // Act + Assert
        assertThatThrownBy(() -> engine.placeShips(host.gameId(), host.playerId(), fleetAt("C1")))
                .isInstanceOf(StateConflictException.class)
                .extracting(e -> ((GameException) e).getReason())
                .isEqualTo("ships_already_placed");
    }

    @Test
    void placeShips_shouldLeaveStateUnchanged_whenFleetIsInvalid() {
        // Arrange
        JoinGameResponseDto host = engine.createSession("Alice");

        // Act + Assert
        assertThatThrownBy(() -> engine.placeShips(host.gameId(), host.playerId(), fleetAt("A5")))
                .isInstanceOf(FleetValidationException.class);
        assertThat(game(host.gameId()).getPhase()).isEqualTo(GamePhase.WAITING);
        assertThat(game(host.gameId()).getPlayers().get(0).isReady()).isFalse();
    }

    @Test
    void placeShips_shouldReject_whenGameIsPlaying() {
        // Arrange
        Game game = startedGame();

        // Act + Assert
        assertThatThrownBy(() -> engine.placeShips(game.getId(), currentPlayer(game), fleetAt("C1")))
                .isInstanceOf(StateConflictException.class)
                .extracting(e -> ((GameException) e).getReason())
                .isEqualTo("invalid_phase");
    }

    // ------------------------------------------------------------------------------------
    // attack
    // ------------------------------------------------------------------------------------

    @Test
    void attack_shouldRegisterHit_andPassTurn() {
        // Arrange
        Game game = startedGame();
        UUID attacker = currentPlayer(game);
        UUID defender = idlePlayer(game);

        // Act
        AttackResultDto result = engine.attack(game.getId(), attacker, "a1");

        // Assert
        assertThat(result.result()).isEqualTo(ShotResult.HIT);
        assertThat(result.position()).isEqualTo("A1");
        assertThat(result.gameOver()).isFalse();
        assertThat(result.nextTurn()).isEqualTo(defender);
        assertThat(game.getTurnNumber()).isEqualTo(2);
        verify(turnClock, atLeastOnce()).start(eq(game.getId()), eq(60_000L), any(Runnable.class));
    }

    @Test
    void attack_shouldRegisterMiss_andPassTurn() {
        // Arrange
        Game game = startedGame();
        UUID attacker = currentPlayer(game);

        // Act
        AttackResultDto result = engine.attack(game.getId(), attacker, "E5");

        // Assert
        assertThat(result.result()).isEqualTo(ShotResult.MISS);
        assertThat(result.nextTurn()).isEqualTo(idlePlayer(game)).isNotEqualTo(attacker);
    }

    @Test
    void attack_shouldFinishGame_whenLastShipSinks() {
        // Arrange
        Game game = startedGame();
        UUID attacker = currentPlayer(game);
        UUID defender = idlePlayer(game);
        engine.attack(game.getId(), attacker, "A1");
        engine.attack(game.getId(), defender, "E5");

        // Act
        AttackResultDto result = engine.attack(game.getId(), attacker, "A2");

        // Assert
        assertThat(result.result()).isEqualTo(ShotResult.SUNK);
        assertThat(result.sunkShip()).isNotNull();
        assertThat(result.gameOver()).isTrue();
        assertThat(result.winner()).isEqualTo(attacker);
        assertThat(result.phase()).isEqualTo(GamePhase.FINISHED);
        assertThat(game.getCurrentTurn()).isNull();
        verify(turnClock).stop(game.getId());
        verify(persistence).snapshot(any(Game.class), eq("game_finished"));
    }

    @Test
    void attack_shouldRejectAttacker_whoDoesNotHoldTurn() {
        // Arrange
        Game game = startedGame();

        // Act + Assert
        assertThatThrownBy(() -> engine.attack(game.getId(), idlePlayer(game), "A1"))
                .isInstanceOf(StateConflictException.class)
                .extracting(e -> ((GameException) e).getReason())
                .isEqualTo("not_your_turn");
    }

    @Test
    void attack_shouldRejectSameCellTwice() {
        // Arrange
        Game game = startedGame();
        UUID attacker = currentPlayer(game);
        UUID defender = idlePlayer(game);
        engine.attack(game.getId(), attacker, "C3");
        engine.attack(game.getId(), defender, "C3");

        // Act + Assert
        assertThatThrownBy(() -> engine.attack(game.getId(), attacker, "C3"))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((GameException) e).getReason())
                .isEqualTo("already_attacked");
        assertThat(game.getCurrentTurn()).isEqualTo(attacker);
    }

    @Test
    void attack_shouldRejectCellOutsideBoard() {
        // Arrange
        Game game = startedGame();

        // Act + Assert
        assertThatThrownBy(() -> engine.attack(game.getId(), currentPlayer(game), "F1"))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((GameException) e).getReason())
                .isEqualTo("position_out_of_bounds");
    }

    @Test
    void attack_shouldRejectMalformedPosition() {
        // Arrange
        Game game = startedGame();

        // Act + Assert
        assertThatThrownBy(() -> engine.attack(game.getId(), currentPlayer(game), "1A"))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((GameException) e).getReason())
                .isEqualTo("position_format");
    }

    @Test
    void attack_shouldReject_beforeGameStarted() {
        // Arrange
        JoinGameResponseDto host = engine.createSession("Alice");

        // Act + Assert
        assertThatThrownBy(() -> engine.attack(host.gameId(), host.playerId(), "A1"))
                .isInstanceOf(StateConflictException.class)
                .extracting(e -> ((GameException) e).getReason())
                .isEqualTo("invalid_phase");
    }

    // ------------------------------------------------------------------------------------
    // Turn timeout
    // ------------------------------------------------------------------------------------

    @Test
    void handleTurnTimeout_shouldPassTurn_andNotifyPlayers() {
        // Arrange
        Game game = startedGame();
        UUID timedOut = currentPlayer(game);
        UUID next = idlePlayer(game);

        // Act
        engine.handleTurnTimeout(game.getId(), timedOut, game.getTurnNumber());

        // Assert
        assertThat(game.getCurrentTurn()).isEqualTo(next);
        assertThat(game.getTurnNumber()).isEqualTo(2);

        ArgumentCaptor<GameEventDto> captor = ArgumentCaptor.forClass(GameEventDto.class);
        verify(connectionHub, atLeastOnce()).publish(eq(game.getId()), captor.capture());
        GameEventDto event = captor.getValue();
        assertThat(event.type()).isEqualTo(GameEventType.TURN_TIMEOUT);
        assertThat(event.payload()).containsEntry("playerId", timedOut).containsEntry("nextTurn", next);
    }

    @Test
    void handleTurnTimeout_shouldIgnoreStaleCallback_ofEarlierTurn() {
        // Arrange
        Game game = startedGame();
        UUID attacker = currentPlayer(game);
        int firstTurn = game.getTurnNumber();
        engine.attack(game.getId(), attacker, "E5");
        UUID holder = game.getCurrentTurn();

        // Act
        engine.handleTurnTimeout(game.getId(), attacker, firstTurn);

        // Assert
        assertThat(game.getCurrentTurn()).isEqualTo(holder);
        assertThat(game.getTurnNumber()).isEqualTo(firstTurn + 1);
    }

    // ------------------------------------------------------------------------------------
    // Views and lifecycle
    // ------------------------------------------------------------------------------------

    @Test
    void getView_shouldHideIntactOpponentShips() {
        // Arrange
        Game game = startedGame();
        UUID attacker = currentPlayer(game);
        engine.attack(game.getId(), attacker, "A1");

        // Act
        GameViewDto view = engine.getView(game.getId(), attacker);

        // Assert
        assertThat(view.ships()).hasSize(1);
        assertThat(view.opponent().hits()).containsExactly("A1");
        assertThat(view.opponent().sunkShips()).isEmpty();
        assertThat(view.yourTurn()).isFalse();
    }

    @Test
    void getView_shouldRejectPlayerOfOtherGame() {
        // Arrange
        JoinGameResponseDto host = engine.createSession("Alice");

        // Act + Assert
        assertThatThrownBy(() -> engine.getView(host.gameId(), UUID.randomUUID()))
                .isInstanceOf(GameNotFoundException.class)
                .extracting(e -> ((GameException) e).getReason())
                .isEqualTo("player_not_found");
    }

    @Test
    void abandon_shouldReleaseGame_andArchiveSnapshot() {
        // Arrange
        Game game = startedGame();

        // Act
        boolean abandoned = engine.abandon(game.getId(), "inactive");

        // Assert
        assertThat(abandoned).isTrue();
        assertThat(game.getPhase()).isEqualTo(GamePhase.ABANDONED);
        assertThat(registry.find(game.getId())).isEmpty();
        verify(turnClock).stop(game.getId());
        verify(connectionHub).closeGame(game.getId());
        verify(reconnectionManager).discardGame(game.getId());
        verify(persistence).archive(any(Game.class), any(Runnable.class));
        assertThat(registry.isRetired(game.getId())).isTrue();
    }

    @Test
    void deleteGame_shouldRemoveGameFromMemoryAndStorage() {
        // Arrange
        JoinGameResponseDto host = engine.createSession("Alice");

        // Act
        engine.deleteGame(host.gameId());

        // Assert
        assertThat(registry.find(host.gameId())).isEmpty();
        verify(persistence).delete(eq(host.gameId()), any(Runnable.class));
        assertThat(registry.isRetired(host.gameId())).isTrue();
        verify(connectionHub).closeGame(host.gameId());
    }
}
