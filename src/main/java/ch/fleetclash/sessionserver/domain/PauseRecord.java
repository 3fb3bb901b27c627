package ch.fleetclash.sessionserver.domain;

import ch.fleetclash.sessionserver.domain.enums.PauseReason;

import java.time.Instant;
import java.util.UUID;

/**
 * Exists while a game is paused.
 *
 * @param reason              why the game was paused
 * @param pausedAt            when the pause started
 * @param pausedByPlayerId    player who caused the pause, may be {@code null}
 * @param remainingTurnMillis turn time left when the pause started, {@code null} if no timer was armed
 */
public record PauseRecord(
        PauseReason reason,
        Instant pausedAt,
        UUID pausedByPlayerId,
        Long remainingTurnMillis
) {
    public boolean causedBy(PauseReason expectedReason, UUID playerId) {
        return reason == expectedReason && playerId != null && playerId.equals(pausedByPlayerId);
    }
}
