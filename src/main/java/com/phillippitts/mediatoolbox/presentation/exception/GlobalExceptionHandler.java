package com.phillippitts.mediatoolbox.presentation.exception;

import com.phillippitts.mediatoolbox.exception.InvalidJobRequestException;
import com.phillippitts.mediatoolbox.exception.SpawnFailureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes. The body is always
 * JSON, including for requests that asked for an event stream.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - malformed job request (HTTP 400).
     */
    @ExceptionHandler(InvalidJobRequestException.class)
    ResponseEntity<ApiError> handleInvalidRequest(InvalidJobRequestException ex) {
        LOG.warn("Invalid job request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Invalid job request", ex.getReason());
    }

    /**
     * Client error - bean validation failed (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        LOG.warn("Job request failed validation: {}", details);
        return respond(HttpStatus.BAD_REQUEST, "ValidationFailed", "Invalid job request", details);
    }

    /**
     * Client error - unreadable body, e.g. an unknown tool (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return respond(HttpStatus.BAD_REQUEST, "UnreadableBody", "Invalid job request",
                "Request body could not be parsed");
    }

    /**
     * Tool could not be started (HTTP 503). Not retried.
     */
    @ExceptionHandler(SpawnFailureException.class)
    ResponseEntity<ApiError> handleSpawnFailure(SpawnFailureException ex) {
        LOG.error("Spawn failed: tool={}", ex.getTool(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Tool could not be started", ex.getMessage());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String code, String message, String details) {
        return ResponseEntity
            .status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
