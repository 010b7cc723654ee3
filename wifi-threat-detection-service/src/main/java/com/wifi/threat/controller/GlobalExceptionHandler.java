package com.wifi.threat.controller;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.wifi.threat.config.WebConfig;
import com.wifi.threat.dto.AccessPointStatus;
import com.wifi.threat.exception.AccessPointNotFoundException;
import com.wifi.threat.exception.ConcurrentUpdateException;
import com.wifi.threat.exception.InvalidPayloadException;
import com.wifi.threat.exception.InvalidStatusException;
import com.wifi.threat.exception.ObservationStoreException;
import com.wifi.threat.exception.UnauthorizedException;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

/**
 * Global exception handler for the threat detection API.
 * Every error body carries timestamp, status, error and message. For client errors raised by this
 * service {@code error} holds the full client-facing text.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String TIMESTAMP = "timestamp";
    private static final String STATUS = "status";
    private static final String ERROR = "error";
    private static final String MESSAGE = "message";

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<Map<String, Object>> handleUnauthorized(UnauthorizedException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return errorResponse(HttpStatus.UNAUTHORIZED, ex.getMessage(), ex.getMessage());
    }

    @ExceptionHandler(InvalidPayloadException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidPayload(InvalidPayloadException ex) {
        log.warn("Invalid payload: {}", ex.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getMessage());
    }

    /**
     * Handles bodies that are not valid JSON or do not bind, e.g. {@code networks} sent as a string.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                                    HttpServletRequest request) {
        log.warn("Unreadable request body on {}: {}", request.getRequestURI(),
                ex.getMostSpecificCause().getMessage());
        String message = request.getRequestURI().endsWith(WebConfig.SCAN_PATH)
                ? ScanController.INVALID_PAYLOAD_MESSAGE
                : "Malformed request body";
        return errorResponse(HttpStatus.BAD_REQUEST, message, message);
    }

    /**
     * Handles query or path values that do not convert, e.g. {@code limit=abc}.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleArgumentTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName());
        log.warn("Rejected request parameter: {}", message);
        return errorResponse(HttpStatus.BAD_REQUEST, "Bad Request", message);
    }

    @ExceptionHandler(InvalidStatusException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidStatus(InvalidStatusException ex) {
        log.warn("Rejected status value: {}", ex.getRejectedValue());
        Map<String, Object> body = errorBody(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getMessage());
        body.put("validValues", AccessPointStatus.validValues());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(AccessPointNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(AccessPointNotFoundException ex) {
        log.debug("Access point not found: {}", ex.getBssid());
        return errorResponse(HttpStatus.NOT_FOUND, "Network not found", ex.getMessage());
    }

    @ExceptionHandler(ConcurrentUpdateException.class)
    public ResponseEntity<Map<String, Object>> handleConcurrentUpdate(ConcurrentUpdateException ex) {
        log.warn("Concurrent update: {}", ex.getMessage());
        return errorResponse(HttpStatus.CONFLICT, "Conflict", ex.getMessage());
    }

    @ExceptionHandler(ObservationStoreException.class)
    public ResponseEntity<Map<String, Object>> handleStoreFailure(ObservationStoreException ex) {
        log.error("Observation store error: {}", ex.getMessage(), ex);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Observation Store Error", ex.getMessage());
    }

    /**
     * Handles all other unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred");
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(errorBody(status, error, message));
    }

    private Map<String, Object> errorBody(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(TIMESTAMP, Instant.now());
        body.put(STATUS, status.value());
        body.put(ERROR, error);
        body.put(MESSAGE, message);
        return body;
    }
}
