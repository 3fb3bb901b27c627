package ch.fleetclash.sessionserver.domain.enums;

/**
 * Represents the outcome of an attack on a board coordinate.
 */
public enum ShotResult {
    /**
     * No ship was hit.
     */
    MISS,

    /**
     * A ship was hit but not sunk.
     */
    HIT,

    /**
     * A ship was hit and sunk.
     */
    SUNK
}
