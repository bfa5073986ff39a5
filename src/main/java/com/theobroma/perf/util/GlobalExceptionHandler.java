package com.theobroma.perf.util;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import lombok.extern.slf4j.Slf4j;

/**
 * Global exception handler for REST controllers.
 *
 * Error response format:
 * <pre>
 * {
 *   "timestamp": "2025-11-16T10:30:00Z",
 *   "status": 404,
 *   "error": "Not Found",
 *   "message": "Farm not found: finca-esperanza",
 *   "path": "/farms/finca-esperanza/lots",
 *   "correlationId": "550e8400-e29b-41d4-a716-446655440000"
 * }
 * </pre>
 *
 * Stack traces never reach the client; unexpected errors are logged with the
 * correlation id the client receives.
 *
 * @see com.theobroma.perf.util.CorrelationIdFilter
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * HTTP 404 for unknown farms and lots.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(
            ResourceNotFoundException ex,
            HttpServletRequest request) {

        log.debug("Resource not found: {}", ex.getMessage());

        return errorResponse(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    /**
     * HTTP 400 for rejected arguments, e.g. a negative slow query threshold.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request) {

        log.warn("Illegal argument: {}", ex.getMessage());

        return errorResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    /**
     * HTTP 400 for missing or malformed request parameters.
     */
    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadParameter(
            Exception ex,
            HttpServletRequest request) {

        log.warn("Bad request parameter: {}", ex.getMessage());

        return errorResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    /**
     * HTTP 503 when the database cannot answer. The query has already been timed and
     * recorded as failed by the time it gets here.
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleDataAccessException(
            DataAccessException ex,
            HttpServletRequest request) {

        log.error("Database error", ex);

        return errorResponse(
            HttpStatus.SERVICE_UNAVAILABLE,
            "Database error. Please contact support with correlation ID.",
            request
        );
    }

    @ExceptionHandler(org.jooq.exception.DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleJooqDataAccessException(
            org.jooq.exception.DataAccessException ex,
            HttpServletRequest request) {

        log.error("Database error", ex);

        return errorResponse(
            HttpStatus.SERVICE_UNAVAILABLE,
            "Database error. Please contact support with correlation ID.",
            request
        );
    }

    /**
     * HTTP 500 for everything else.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        log.error("Unhandled exception", ex);

        return errorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred. Please contact support with correlation ID.",
            request
        );
    }

    private ResponseEntity<Map<String, Object>> errorResponse(
            HttpStatus status, String message, HttpServletRequest request) {

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        body.put("path", request.getRequestURI());
        body.put("correlationId", CorrelationIdFilter.getCurrentCorrelationId());

        return new ResponseEntity<>(body, status);
    }
}
