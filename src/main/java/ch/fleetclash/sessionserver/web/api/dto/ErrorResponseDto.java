package ch.fleetclash.sessionserver.web.api.dto;

import ch.fleetclash.sessionserver.exception.ErrorCategory;
import ch.fleetclash.sessionserver.exception.PlacementViolation;

import java.time.Instant;
import java.util.List;

public record ErrorResponseDto(
        ErrorCategory category,
        String reason,
        String message,
        List<PlacementViolation> violations,
        Instant timestamp
) {}
