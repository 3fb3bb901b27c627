package ch.fleetclash.sessionserver.domain;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Participant of a game.
 *
 * <p>Identity and name never change; only the ready flag, the board record and the fleet
 * are mutated, and only by the session engine.
 */
@Getter
public class Player {

    private final UUID id;
    private final String name;
    private final Board board;
    private final List<Ship> ships = new ArrayList<>();
    private boolean ready;

    public Player(UUID id, String name, int boardSize) {
        this.id = id;
        this.name = name;
        this.board = new Board(boardSize);
    }

    public Player(String name, int boardSize) {
        this(UUID.randomUUID(), name, boardSize);
    }

    public List<Ship> getShips() {
        return Collections.unmodifiableList(ships);
    }

    public boolean hasShipsPlaced() {
        return !ships.isEmpty();
    }

    /**
     * Stores the validated fleet and marks the player as ready.
     */
    public void placeFleet(List<Ship> fleet) {
        ships.clear();
        ships.addAll(fleet);
        ready = true;
    }

    public Optional<Ship> shipAt(Coordinate coordinate) {
        return ships.stream().filter(s -> s.occupies(coordinate)).findFirst();
    }

    public boolean isFleetDestroyed() {
        return !ships.isEmpty() && ships.stream().allMatch(Ship::isSunk);
    }

    public boolean hasName(String candidate) {
        return candidate != null && name.equalsIgnoreCase(candidate.trim());
    }
}
