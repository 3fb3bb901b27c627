package ch.fleetclash.sessionserver.domain;

import java.util.List;

/**
 * Requested placement of one ship.
 *
 * <p>Two encodings exist at the API boundary, a start cell with an orientation and an explicit
 * list of cells. Both normalize to an ordered coordinate list before any rule is checked.
 */
public interface ShipPlacement {

    /**
     * @return declared ship length
     */
    int length();

    /**
     * Resolves the placement to the cells it would occupy.
     *
     * @return ordered cells, not yet checked against the board
     * @throws ch.fleetclash.sessionserver.exception.ValidationException if a coordinate is malformed
     */
    List<Coordinate> resolve();
}
