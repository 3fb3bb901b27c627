package ch.fleetclash.sessionserver.web.api.dto;

import ch.fleetclash.sessionserver.domain.AnchoredPlacement;
import ch.fleetclash.sessionserver.domain.PositionListPlacement;
import ch.fleetclash.sessionserver.domain.ShipPlacement;
import ch.fleetclash.sessionserver.domain.enums.Orientation;
import ch.fleetclash.sessionserver.exception.ValidationException;

import java.util.List;
import java.util.Locale;

/**
 * One ship of a placement request, in either of the two accepted encodings:
 * <ul>
 *   <li>{@code length} + {@code startPosition} + {@code direction} ({@code horizontal} / {@code vertical})</li>
 *   <li>{@code length} + {@code positions} (explicit cells)</li>
 * </ul>
 * When {@code positions} is present it takes precedence.
 */
public record ShipPlacementRequest(
        int length,
        String startPosition,
        String direction,
        List<String> positions
) {
    public ShipPlacement toPlacement() {
        if (positions != null && !positions.isEmpty()) {
            return new PositionListPlacement(length, positions);
        }
        if (startPosition == null || direction == null) {
            throw new ValidationException("ship_format",
                    "Ship needs either positions or startPosition and direction");
        }
        return new AnchoredPlacement(length, startPosition, parseDirection(direction));
    }

    private static Orientation parseDirection(String raw) {
        try {
            return Orientation.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("ship_format", "Unknown direction: " + raw);
        }
    }
}
