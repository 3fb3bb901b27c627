package ch.fleetclash.sessionserver.domain;

import ch.fleetclash.sessionserver.exception.ValidationException;
import lombok.Getter;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable value object representing a cell on the game board.
 *
 * <p>Rows are letters ({@code A} = row 0) and columns are 1-based numbers, so {@code "C7"} is
 * row 2, column 6 internally. Implements {@link #equals(Object)} and {@link #hashCode()} to support
 * set operations (hit/miss tracking, overlap detection).
 */
@Getter
public final class Coordinate {

    private static final Pattern FORMAT = Pattern.compile("^([A-Z])([1-9][0-9]?)$");

    /**
     * 0-based row index (letter A = 0).
     */
    private final int row;

    /**
     * 0-based column index (number 1 = 0).
     */
    private final int column;

    public Coordinate(int row, int column) {
        this.row = row;
        this.column = column;
    }

    /**
     * Parses a coordinate in board notation. Input is case-insensitive and surrounding
     * whitespace is ignored.
     *
     * @param raw coordinate such as {@code "a1"} or {@code "J10"}
     * @return parsed coordinate (not yet checked against a board size)
     * @throws ValidationException if the input does not follow the letter+number notation
     */
    public static Coordinate parse(String raw) {
        if (raw == null) {
            throw new ValidationException("position_format", "Coordinate is missing");
        }
        Matcher m = FORMAT.matcher(raw.trim().toUpperCase(Locale.ROOT));
        if (!m.matches()) {
            throw new ValidationException("position_format", "Malformed coordinate: " + raw);
        }
        int row = m.group(1).charAt(0) - 'A';
        int column = Integer.parseInt(m.group(2)) - 1;
        return new Coordinate(row, column);
    }

    /**
     * @param boardSize edge length of the square board
     * @return {@code true} if this cell lies on a board of the given size
     */
    public boolean isWithin(int boardSize) {
        return row >= 0 && row < boardSize && column >= 0 && column < boardSize;
    }

    /**
     * Returns a neighbouring coordinate shifted by the given offsets.
     */
    public Coordinate offset(int rowDelta, int columnDelta) {
        return new Coordinate(row + rowDelta, column + columnDelta);
    }

    /**
     * Chebyshev neighbourhood check: horizontally, vertically or diagonally touching, but not the same cell.
     */
    public boolean isAdjacentTo(Coordinate other) {
        int dr = Math.abs(row - other.row);
        int dc = Math.abs(column - other.column);
        return dr <= 1 && dc <= 1 && !(dr == 0 && dc == 0);
    }

    /**
     * @return board notation, e.g. {@code "A1"}
     */
    @Override
    public String toString() {
        return String.valueOf((char) ('A' + row)) + (column + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Coordinate other)) return false;
        return row == other.row && column == other.column;
    }

    @Override
    public int hashCode() {
        return 31 * row + column;
    }
}
