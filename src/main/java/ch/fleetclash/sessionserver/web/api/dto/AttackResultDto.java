package ch.fleetclash.sessionserver.web.api.dto;

import ch.fleetclash.sessionserver.domain.enums.GamePhase;
import ch.fleetclash.sessionserver.domain.enums.ShotResult;

import java.util.UUID;

/**
 * Outcome of an attack as returned to the attacker.
 *
 * @param nextTurn player holding the turn after this attack, {@code null} once the game is over
 * @param winner   set when this attack sank the last ship
 */
public record AttackResultDto(
        ShotResult result,
        String position,
        ShipDto sunkShip,
        UUID nextTurn,
        boolean gameOver,
        UUID winner,
        GamePhase phase
) {}
