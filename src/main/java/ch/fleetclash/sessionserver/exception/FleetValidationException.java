package ch.fleetclash.sessionserver.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when a submitted fleet breaks one or more placement rules.
 * All violations found are reported together.
 */
@Getter
public class FleetValidationException extends ValidationException {

    private final List<PlacementViolation> violations;

    public FleetValidationException(List<PlacementViolation> violations) {
        super("invalid_fleet", "Ship placement rejected with " + violations.size() + " violation(s)");
        this.violations = List.copyOf(violations);
    }
}
