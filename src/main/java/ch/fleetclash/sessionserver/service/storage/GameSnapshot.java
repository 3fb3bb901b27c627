package ch.fleetclash.sessionserver.service.storage;

import ch.fleetclash.sessionserver.domain.Coordinate;
import ch.fleetclash.sessionserver.domain.Game;
import ch.fleetclash.sessionserver.domain.GameConfiguration;
import ch.fleetclash.sessionserver.domain.PauseRecord;
import ch.fleetclash.sessionserver.domain.Player;
import ch.fleetclash.sessionserver.domain.Ship;
import ch.fleetclash.sessionserver.domain.enums.GamePhase;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Immutable, serializable copy of a {@link Game}.
 *
 * <p>Taken while the game lock is held, then handed to the storage collaborator on a background
 * thread, so storage never sees a game that is being mutated.
 */
public record GameSnapshot(
        String gameId,
        GamePhase phase,
        int boardSize,
        List<Integer> fleet,
        boolean allowAdjacent,
        long turnTimeoutMs,
        List<PlayerState> players,
        UUID currentTurn,
        UUID winner,
        int turnNumber,
        Instant turnStartedAt,
        Instant createdAt,
        Instant lastActivity,
        PauseRecord pause
) {

    public record PlayerState(
            UUID id,
            String name,
            boolean ready,
            List<String> hits,
            List<String> misses,
            List<ShipState> ships
    ) {}

    public record ShipState(
            String id,
            List<String> positions,
            int hits,
            boolean sunk
    ) {}

    public static GameSnapshot of(Game game) {
        GameConfiguration config = game.getConfiguration();
        List<PlayerState> players = game.getPlayers().stream()
                .map(GameSnapshot::playerState)
                .toList();
        return new GameSnapshot(
                game.getId(),
                game.getPhase(),
                config.getBoardSize(),
                config.getFleet(),
                config.isAllowAdjacent(),
                config.getTurnTimeoutMs(),
                players,
                game.getCurrentTurn(),
                game.getWinner(),
                game.getTurnNumber(),
                game.getTurnStartedAt(),
                game.getCreatedAt(),
                game.getLastActivity(),
                game.getPauseRecord()
        );
    }

    /**
     * Rebuilds a mutable game from this snapshot.
     */
    public Game toGame() {
        GameConfiguration config = new GameConfiguration(boardSize, fleet, allowAdjacent, turnTimeoutMs);
        Game game = new Game(gameId, config, createdAt);
        for (PlayerState state : players) {
            Player player = new Player(state.id(), state.name(), boardSize);
            List<Ship> ships = state.ships().stream()
                    .map(s -> Ship.restore(s.id(), parse(s.positions()), s.hits(), s.sunk()))
                    .toList();
            if (!ships.isEmpty()) {
                player.placeFleet(ships);
            }
            parse(state.hits()).forEach(player.getBoard()::recordHit);
            parse(state.misses()).forEach(player.getBoard()::recordMiss);
            game.addPlayer(player);
        }
        game.setPhase(phase);
        game.setCurrentTurn(currentTurn);
        game.setWinner(winner);
        game.setTurnNumber(turnNumber);
        game.setTurnStartedAt(turnStartedAt);
        game.setLastActivity(lastActivity);
        game.setPauseRecord(pause);
        return game;
    }

    private static PlayerState playerState(Player player) {
        List<ShipState> ships = player.getShips().stream()
                .map(s -> new ShipState(s.getId(), format(s.getPositions()), s.getHits(), s.isSunk()))
                .toList();
        return new PlayerState(
                player.getId(),
                player.getName(),
                player.isReady(),
                format(player.getBoard().getHits()),
                format(player.getBoard().getMisses()),
                ships
        );
    }

    private static List<String> format(Collection<Coordinate> coordinates) {
        return coordinates.stream().map(Coordinate::toString).toList();
    }

    private static List<Coordinate> parse(List<String> cells) {
        return cells.stream().map(Coordinate::parse).toList();
    }
}
