package ch.fleetclash.sessionserver.service;

import ch.fleetclash.sessionserver.domain.Coordinate;
import ch.fleetclash.sessionserver.domain.GameConfiguration;
import ch.fleetclash.sessionserver.domain.Ship;
import ch.fleetclash.sessionserver.domain.ShipPlacement;
import ch.fleetclash.sessionserver.exception.FleetValidationException;
import ch.fleetclash.sessionserver.exception.PlacementViolation;
import ch.fleetclash.sessionserver.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a submitted fleet against the rules of a game.
 *
 * <p>Rules:
 * <ul>
 *   <li>the multiset of ship lengths equals the configured fleet</li>
 *   <li>each ship covers exactly {@code length} cells in one row or one column without gaps</li>
 *   <li>every cell lies on the board</li>
 *   <li>ships neither overlap nor touch, diagonals included, unless adjacency is allowed</li>
 * </ul>
 * All violations are collected so a client can fix the whole fleet in one round trip.
 */
@Component
public class FleetValidator {

    /**
     * Validates the placements and builds the ships.
     *
     * @param placements ships in submitted order
     * @param config     rules of the game
     * @return ships named {@code ship-1}, {@code ship-2}, ... in submitted order
     * @throws FleetValidationException if any rule is broken
     */
    public List<Ship> validate(List<ShipPlacement> placements, GameConfiguration config) {
        List<PlacementViolation> violations = new ArrayList<>();

        checkFleetComposition(placements, config.getFleet(), violations);

        // index -> cells, only for ships whose own shape is valid
        Map<Integer, List<Coordinate>> shapes = new LinkedHashMap<>();
        for (int i = 0; i < placements.size(); i++) {
            List<Coordinate> cells = resolveShape(i, placements.get(i), config.getBoardSize(), violations);
            if (cells != null) {
                shapes.put(i, cells);
            }
        }

        checkPairs(shapes, config.isAllowAdjacent(), violations);

        if (!violations.isEmpty()) {
            throw new FleetValidationException(violations);
        }

        List<Ship> ships = new ArrayList<>();
        shapes.forEach((index, cells) -> ships.add(new Ship("ship-" + (index + 1), cells)));
        return ships;
    }

    private void checkFleetComposition(List<ShipPlacement> placements, List<Integer> fleet,
                                       List<PlacementViolation> violations) {
        if (placements.size() != fleet.size()) {
            violations.add(new PlacementViolation("ship_count",
                    "Expected " + fleet.size() + " ships, got " + placements.size(), null));
        }
        List<Integer> expected = fleet.stream().sorted(Comparator.reverseOrder()).toList();
        List<Integer> actual = placements.stream().map(ShipPlacement::length)
                .sorted(Comparator.reverseOrder()).toList();
        if (!expected.equals(actual)) {
            violations.add(new PlacementViolation("ship_length",
                    "Ship lengths must be " + expected + ", got " + actual, null));
        }
    }

    private List<Coordinate> resolveShape(int index, ShipPlacement placement, int boardSize,
                                          List<PlacementViolation> violations) {
        if (placement.length() < 1) {
            violations.add(new PlacementViolation("ship_format", "Ship length must be positive", index));
            return null;
        }
        // checked before resolving, the cell list is sized by the claimed length
        if (placement.length() > boardSize) {
            violations.add(new PlacementViolation("ship_bounds",
                    "Ship of length " + placement.length() + " does not fit on a board of size " + boardSize, index));
            return null;
        }

        List<Coordinate> cells;
        try {
            cells = placement.resolve();
        } catch (ValidationException e) {
            violations.add(new PlacementViolation("position_format", e.getMessage(), index));
            return null;
        }

        if (cells.size() != placement.length()) {
            violations.add(new PlacementViolation("ship_format",
                    "Ship of length " + placement.length() + " needs " + placement.length()
                            + " positions, got " + cells.size(), index));
            return null;
        }

        List<Coordinate> ordered = orderedRun(cells);
        if (ordered == null) {
            violations.add(new PlacementViolation("ship_format",
                    "Positions must form one contiguous horizontal or vertical line", index));
            return null;
        }

        List<Coordinate> outside = ordered.stream().filter(c -> !c.isWithin(boardSize)).toList();
        if (!outside.isEmpty()) {
            violations.add(new PlacementViolation("ship_bounds",
                    "Ship leaves the board at " + outside.get(0), index));
            return null;
        }
        return ordered;
    }

    /**
     * @return the cells sorted along their line, or {@code null} if they are not one gap-free row or column
     */
    private List<Coordinate> orderedRun(List<Coordinate> cells) {
        if (cells.size() == 1) {
            return cells;
        }
        boolean sameRow = cells.stream().allMatch(c -> c.getRow() == cells.get(0).getRow());
        boolean sameColumn = cells.stream().allMatch(c -> c.getColumn() == cells.get(0).getColumn());
        if (!sameRow && !sameColumn) {
            return null;
        }
        Comparator<Coordinate> axis = sameRow
                ? Comparator.comparingInt(Coordinate::getColumn)
                : Comparator.comparingInt(Coordinate::getRow);
        List<Coordinate> sorted = cells.stream().sorted(axis).toList();
        for (int i = 1; i < sorted.size(); i++) {
            int step = sameRow
                    ? sorted.get(i).getColumn() - sorted.get(i - 1).getColumn()
                    : sorted.get(i).getRow() - sorted.get(i - 1).getRow();
            if (step != 1) {
                return null;
            }
        }
        return sorted;
    }

    private void checkPairs(Map<Integer, List<Coordinate>> shapes, boolean allowAdjacent,
                            List<PlacementViolation> violations) {
        List<Integer> indexes = new ArrayList<>(shapes.keySet());
        for (int a = 0; a < indexes.size(); a++) {
            for (int b = a + 1; b < indexes.size(); b++) {
                int first = indexes.get(a);
                int second = indexes.get(b);
                List<Coordinate> cellsA = shapes.get(first);
                List<Coordinate> cellsB = shapes.get(second);

                Set<Coordinate> shared = new HashSet<>(cellsA);
                shared.retainAll(cellsB);
                if (!shared.isEmpty()) {
                    violations.add(new PlacementViolation("ship_overlap",
                            "Ship " + (second + 1) + " overlaps ship " + (first + 1)
                                    + " at " + shared.iterator().next(), second));
                } else if (!allowAdjacent && touches(cellsA, cellsB)) {
                    violations.add(new PlacementViolation("ship_adjacent",
                            "Ship " + (second + 1) + " touches ship " + (first + 1), second));
                }
            }
        }
    }

    private boolean touches(List<Coordinate> a, List<Coordinate> b) {
        return a.stream().anyMatch(ca -> b.stream().anyMatch(ca::isAdjacentTo));
    }
}
