package com.fieldpilot.lifecycle.api;

import com.fieldpilot.lifecycle.api.dto.ErrorResponse;
import com.fieldpilot.lifecycle.statemachine.TransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.NoSuchElementException;

/**
 * Maps domain exceptions to HTTP responses with a uniform
 * {kind, message, details, retryable} body.
 *
 *   JOB_NOT_FOUND            → 404
 *   INVALID_TRANSITION       → 409
 *   FORBIDDEN                → 403
 *   PRECONDITION_FAILED      → 422
 *   CONCURRENT_MODIFICATION  → 409, retryable
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(TransitionException.class)
    public ResponseEntity<ErrorResponse> handleTransition(TransitionException ex) {
        HttpStatus status = switch (ex.getKind()) {
            case JOB_NOT_FOUND           -> HttpStatus.NOT_FOUND;
            case INVALID_TRANSITION      -> HttpStatus.CONFLICT;
            case FORBIDDEN               -> HttpStatus.FORBIDDEN;
            case PRECONDITION_FAILED     -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CONCURRENT_MODIFICATION -> HttpStatus.CONFLICT;
        };
        log.debug("Transition rejected for job {}: {}", ex.getJobId(), ex.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(
                ex.getKind().name(), ex.getMessage(), ex.getDetails(), ex.isRetryable()));
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NoSuchElementException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return ResponseEntity.status(status).body(ErrorResponse.of(status.name(), ex.getReason()));
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingRequestHeaderException.class,
                       HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("BAD_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleConflict(IllegalStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of("CONFLICT", ex.getMessage()));
    }
}
