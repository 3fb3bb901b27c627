package ch.fleetclash.sessionserver.service;

import ch.fleetclash.sessionserver.domain.Board;
import ch.fleetclash.sessionserver.domain.Coordinate;
import ch.fleetclash.sessionserver.domain.Game;
import ch.fleetclash.sessionserver.domain.PauseRecord;
import ch.fleetclash.sessionserver.domain.Player;
import ch.fleetclash.sessionserver.domain.enums.GamePhase;
import ch.fleetclash.sessionserver.domain.enums.PauseReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Detects internal invariant violations of a game and resets it to a safe state.
 *
 * <p>Violations are programming errors, not user errors, so they are logged at ERROR level and
 * never reported to the caller as a failure of the current request.
 *
 * <p>Checked invariants and repairs:
 * <ul>
 *   <li>a playing or paused game has a current turn held by one of its players; repaired by giving
 *       the turn to the first player</li>
 *   <li>a finished game has a winner; repaired by abandoning the game</li>
 *   <li>a pause record exists iff the game is paused; repaired by adding a manual record or dropping it</li>
 *   <li>hit and miss sets of a board are disjoint; repaired by dropping the miss</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GameIntegrityChecker {

    private final Clock clock;

    /**
     * Checks and repairs a game. Must be called while holding the game's lock.
     *
     * @return descriptions of the violations found, empty if the game is consistent
     */
    public List<String> verifyAndRepair(Game game) {
        List<String> violations = new ArrayList<>();
        Instant now = clock.instant();
        GamePhase phase = game.getPhase();

        if (phase == GamePhase.PLAYING || phase == GamePhase.PAUSED) {
            boolean validTurn = game.findPlayer(game.getCurrentTurn()).isPresent();
            if (!validTurn && !game.getPlayers().isEmpty()) {
                Player first = game.getPlayers().get(0);
                violations.add(phase + " without valid current turn (was " + game.getCurrentTurn()
                        + "), turn given to " + first.getName());
                game.beginTurn(first.getId(), now);
            }
        }

        if (phase == GamePhase.FINISHED && game.findPlayer(game.getWinner()).isEmpty()) {
            violations.add("FINISHED without winner, game abandoned");
            game.transitionTo(GamePhase.ABANDONED, now);
        }

        if (game.getPhase() == GamePhase.PAUSED && game.getPauseRecord() == null) {
            violations.add("PAUSED without pause record, manual pause recorded");
            game.setPauseRecord(new PauseRecord(PauseReason.MANUAL, now, null, null));
        } else if (game.getPhase() != GamePhase.PAUSED && game.getPauseRecord() != null) {
            violations.add("pause record present in phase " + game.getPhase() + ", record dropped");
            game.setPauseRecord(null);
        }

        for (Player player : game.getPlayers()) {
            Board board = player.getBoard();
            Set<Coordinate> overlap = new HashSet<>(board.getMisses());
            overlap.retainAll(board.getHits());
            if (!overlap.isEmpty()) {
                violations.add("board of " + player.getName() + " has cells both hit and missed: " + overlap);
                board.getMisses().removeAll(overlap);
            }
        }

        if (!violations.isEmpty()) {
            violations.forEach(v -> log.error("Integrity violation in game {}: {}", game.getId(), v));
            game.record("integrity_repair", null, now, Map.of("violations", List.copyOf(violations)));
        }
        return violations;
    }
}
