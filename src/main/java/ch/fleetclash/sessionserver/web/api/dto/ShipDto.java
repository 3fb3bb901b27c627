package ch.fleetclash.sessionserver.web.api.dto;

import ch.fleetclash.sessionserver.domain.Coordinate;
import ch.fleetclash.sessionserver.domain.Ship;

import java.util.List;

public record ShipDto(
        String id,
        int length,
        List<String> positions,
        int hits,
        boolean sunk
) {
    public static ShipDto from(Ship ship) {
        return new ShipDto(
                ship.getId(),
                ship.getLength(),
                ship.getPositions().stream().map(Coordinate::toString).toList(),
                ship.getHits(),
                ship.isSunk()
        );
    }
}
