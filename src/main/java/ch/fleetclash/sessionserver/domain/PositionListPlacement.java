package ch.fleetclash.sessionserver.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ship placement given as an explicit list of cells. Continuity is checked by the fleet validator.
 */
public record PositionListPlacement(
        int length,
        List<String> positions
) implements ShipPlacement {

    public PositionListPlacement {
        positions = positions == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(positions));
    }

    @Override
    public List<Coordinate> resolve() {
        return positions.stream().map(Coordinate::parse).toList();
    }
}
