package ch.fleetclash.sessionserver.web.api.dto;

import java.util.UUID;

/**
 * Request DTO used to attack a cell of the opponent's board.
 *
 * @param attackerId identifier of the attacking player
 * @param position   target cell in board notation, e.g. {@code "B7"}
 */
public record AttackRequest(
        UUID attackerId,
        String position
) {}
