package ch.fleetclash.sessionserver.web.api.dto;

import ch.fleetclash.sessionserver.domain.Coordinate;
import ch.fleetclash.sessionserver.domain.Game;
import ch.fleetclash.sessionserver.domain.PauseRecord;
import ch.fleetclash.sessionserver.domain.Player;
import ch.fleetclash.sessionserver.domain.Ship;
import ch.fleetclash.sessionserver.domain.enums.GamePhase;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Game state as seen by one player.
 *
 * <p>The own fleet is fully visible; of the opponent only attack results and already sunk ships
 * are exposed, never the position of intact ships.
 */
public record GameViewDto(
        String gameId,
        GamePhase phase,
        UUID playerId,
        String playerName,
        boolean ready,
        List<ShipDto> ships,
        List<String> hitsReceived,
        List<String> missesReceived,
        OpponentViewDto opponent,
        UUID currentTurn,
        boolean yourTurn,
        UUID winner,
        int turnNumber,
        Long remainingTurnMs,
        PauseRecord pause
) {

    public record OpponentViewDto(
            UUID playerId,
            String playerName,
            boolean ready,
            List<String> hits,
            List<String> misses,
            List<ShipDto> sunkShips
    ) {}

    public static GameViewDto forPlayer(Game game, Player player, Long remainingTurnMs) {
        OpponentViewDto opponent = game.opponentOf(player.getId())
                .map(GameViewDto::opponentView)
                .orElse(null);
        return new GameViewDto(
                game.getId(),
                game.getPhase(),
                player.getId(),
                player.getName(),
                player.isReady(),
                player.getShips().stream().map(ShipDto::from).toList(),
                format(player.getBoard().getHits()),
                format(player.getBoard().getMisses()),
                opponent,
                game.getCurrentTurn(),
                player.getId().equals(game.getCurrentTurn()),
                game.getWinner(),
                game.getTurnNumber(),
                remainingTurnMs,
                game.getPauseRecord()
        );
    }

    private static OpponentViewDto opponentView(Player opponent) {
        return new OpponentViewDto(
                opponent.getId(),
                opponent.getName(),
                opponent.isReady(),
                format(opponent.getBoard().getHits()),
                format(opponent.getBoard().getMisses()),
                opponent.getShips().stream().filter(Ship::isSunk).map(ShipDto::from).toList()
        );
    }

    private static List<String> format(Collection<Coordinate> coordinates) {
        return coordinates.stream().map(Coordinate::toString).toList();
    }
}
