package ch.fleetclash.sessionserver.web.api.controller;

import ch.fleetclash.sessionserver.exception.ErrorCategory;
import ch.fleetclash.sessionserver.exception.FleetValidationException;
import ch.fleetclash.sessionserver.exception.GameException;
import ch.fleetclash.sessionserver.exception.PlacementViolation;
import ch.fleetclash.sessionserver.web.api.dto.ErrorResponseDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

/**
 * Maps expected game failures to structured error responses.
 *
 * <p>Status codes: not-found 404, state-conflict 409, validation 400, capacity 409,
 * expired-credential 401.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(GameException.class)
    public ResponseEntity<ErrorResponseDto> handleGameException(GameException e) {
        List<PlacementViolation> violations = e instanceof FleetValidationException fleet
                ? fleet.getViolations()
                : List.of();
        log.debug("Request rejected ({} / {}): {}", e.getCategory(), e.getReason(), e.getMessage());
        return ResponseEntity.status(statusOf(e.getCategory()))
                .body(new ErrorResponseDto(e.getCategory(), e.getReason(), e.getMessage(), violations, Instant.now()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponseDto> handleMalformedRequest(Exception e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponseDto(ErrorCategory.VALIDATION, "malformed_request",
                        "Request could not be read", List.of(), Instant.now()));
    }

    static HttpStatus statusOf(ErrorCategory category) {
        return switch (category) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case STATE_CONFLICT, CAPACITY -> HttpStatus.CONFLICT;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case EXPIRED_CREDENTIAL -> HttpStatus.UNAUTHORIZED;
        };
    }
}
