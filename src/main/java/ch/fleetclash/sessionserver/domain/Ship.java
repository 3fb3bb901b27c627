package ch.fleetclash.sessionserver.domain;

import lombok.Getter;

import java.util.List;

/**
 * A placed ship.
 *
 * <p>{@code positions.size() == length} always holds. The {@code sunk} flag is set exactly once,
 * by the hit that brings {@code hits} up to {@code length}.
 */
@Getter
public class Ship {

    private final String id;
    private final int length;
    private final List<Coordinate> positions;
    private int hits;
    private boolean sunk;

    public Ship(String id, List<Coordinate> positions) {
        this.id = id;
        this.positions = List.copyOf(positions);
        this.length = this.positions.size();
    }

    /**
     * Restores a ship from a stored state.
     */
    public static Ship restore(String id, List<Coordinate> positions, int hits, boolean sunk) {
        Ship ship = new Ship(id, positions);
        ship.hits = hits;
        ship.sunk = sunk;
        return ship;
    }

    public boolean occupies(Coordinate coordinate) {
        return positions.contains(coordinate);
    }

    /**
     * Registers a hit on this ship.
     *
     * @return {@code true} if this hit sank the ship
     */
    public boolean registerHit() {
        if (hits < length) {
            hits++;
        }
        if (!sunk && hits >= length) {
            sunk = true;
            return true;
        }
        return false;
    }
}
