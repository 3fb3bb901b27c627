package ch.fleetclash.sessionserver.domain.enums;

/**
 * Direction in which an anchored ship extends from its start coordinate.
 * HORIZONTAL advances the column number, VERTICAL advances the row letter.
 */
public enum Orientation {
    HORIZONTAL,
    VERTICAL
}
