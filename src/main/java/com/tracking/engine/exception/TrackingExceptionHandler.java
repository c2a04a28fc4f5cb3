package com.tracking.engine.exception;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

/**
 * Maps engine failures to HTTP responses for the REST surface.
 */
@RestControllerAdvice
@Slf4j
public class TrackingExceptionHandler {

    @ExceptionHandler(ConfigInvalidException.class)
    public ResponseEntity<ErrorResponse> handleConfigInvalid(ConfigInvalidException ex, HttpServletRequest request) {
        log.warn("Configuration rejected: {}", ex.getViolations());
        return respond(HttpStatus.BAD_REQUEST, ex.getKind().name(), "Invalid tracking configuration",
                ex.getViolations(), request);
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<ErrorResponse> handlePermissionDenied(PermissionDeniedException ex, HttpServletRequest request) {
        return respond(HttpStatus.FORBIDDEN, ex.getKind().name(), ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler(TrackingException.class)
    public ResponseEntity<ErrorResponse> handleTracking(TrackingException ex, HttpServletRequest request) {
        HttpStatus status = switch (ex.getKind()) {
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case CONFIG_INVALID, FILTER_REJECTED -> HttpStatus.BAD_REQUEST;
            case PERMISSION_DENIED -> HttpStatus.FORBIDDEN;
            case SYNC_RETRYABLE, SYNC_TERMINAL -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        log.error("Tracking operation failed on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(status, ex.getKind().name(), ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException ex, HttpServletRequest request) {
        log.warn("Rejected in current session state: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "INVALID_STATE", ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<String> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .sorted()
                .toList();
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request validation failed", violations, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        List<String> violations = ex.getConstraintViolations().stream()
                .map(ConstraintViolation::getMessage)
                .sorted()
                .toList();
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request validation failed", violations, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Malformed request body", List.of(), request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message,
                                                  List<String> violations, HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.builder()
                .errorCode(code)
                .message(message)
                .violations(violations)
                .status(status.value())
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
