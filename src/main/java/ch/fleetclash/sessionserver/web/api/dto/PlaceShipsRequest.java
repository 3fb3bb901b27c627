package ch.fleetclash.sessionserver.web.api.dto;

import ch.fleetclash.sessionserver.domain.ShipPlacement;
import ch.fleetclash.sessionserver.exception.FleetValidationException;
import ch.fleetclash.sessionserver.exception.PlacementViolation;
import ch.fleetclash.sessionserver.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;

public record PlaceShipsRequest(
        List<ShipPlacementRequest> ships
) {
    /**
     * Converts every entry to a placement.
     *
     * @throws FleetValidationException listing every entry that is empty or in neither encoding
     */
    public List<ShipPlacement> toPlacements() {
        if (ships == null) {
            return List.of();
        }
        List<ShipPlacement> placements = new ArrayList<>();
        List<PlacementViolation> violations = new ArrayList<>();
        for (int i = 0; i < ships.size(); i++) {
            ShipPlacementRequest ship = ships.get(i);
            if (ship == null) {
                violations.add(new PlacementViolation("ship_format", "Ship entry is empty", i));
                continue;
            }
            try {
                placements.add(ship.toPlacement());
            } catch (ValidationException e) {
                violations.add(new PlacementViolation("ship_format", e.getMessage(), i));
            }
        }
        if (!violations.isEmpty()) {
            throw new FleetValidationException(violations);
        }
        return placements;
    }
}
