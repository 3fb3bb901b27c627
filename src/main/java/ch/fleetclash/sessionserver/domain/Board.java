package ch.fleetclash.sessionserver.domain;

import lombok.Getter;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Attack record of one player's board: which cells were hit and which were misses.
 *
 * <p>Both sets are disjoint and every coordinate lies within {@code size x size}.
 */
@Getter
public class Board {

    private final int size;
    private final Set<Coordinate> hits = new LinkedHashSet<>();
    private final Set<Coordinate> misses = new LinkedHashSet<>();

    public Board(int size) {
        this.size = size;
    }

    public boolean isAttacked(Coordinate coordinate) {
        return hits.contains(coordinate) || misses.contains(coordinate);
    }

    public void recordHit(Coordinate coordinate) {
        misses.remove(coordinate);
        hits.add(coordinate);
    }

    public void recordMiss(Coordinate coordinate) {
        if (!hits.contains(coordinate)) {
            misses.add(coordinate);
        }
    }

    public int getAttackCount() {
        return hits.size() + misses.size();
    }
}
