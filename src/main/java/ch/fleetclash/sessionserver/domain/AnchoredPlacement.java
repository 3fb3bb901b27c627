package ch.fleetclash.sessionserver.domain;

import ch.fleetclash.sessionserver.domain.enums.Orientation;

import java.util.ArrayList;
import java.util.List;

/**
 * Ship placement given as start cell plus orientation, e.g. length 5 from {@code A1} horizontal
 * covers {@code A1..A5}.
 */
public record AnchoredPlacement(
        int length,
        String start,
        Orientation orientation
) implements ShipPlacement {

    @Override
    public List<Coordinate> resolve() {
        Coordinate origin = Coordinate.parse(start);
        List<Coordinate> cells = new ArrayList<>(Math.max(length, 0));
        for (int i = 0; i < length; i++) {
            cells.add(orientation == Orientation.HORIZONTAL ? origin.offset(0, i) : origin.offset(i, 0));
        }
        return cells;
    }
}
