package ch.fleetclash.sessionserver.exception;

/**
 * Single rule violation found while validating a fleet.
 *
 * @param type      violation code, e.g. {@code ship_overlap}
 * @param message   human readable description
 * @param shipIndex index of the offending ship in the submitted list, or {@code null} for fleet-wide problems
 */
public record PlacementViolation(
        String type,
        String message,
        Integer shipIndex
) {}
