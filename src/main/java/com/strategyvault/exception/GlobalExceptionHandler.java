package com.strategyvault.exception;

import com.strategyvault.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler for all REST controllers.
 * Maps vault error categories to HTTP statuses and wraps every error in an {@link ApiResponse}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String MALFORMED_JSON_MESSAGE = "Malformed JSON request. Please check your request body format.";

    /**
     * Handles every rejected vault operation. State is unchanged when these reach the client.
     */
    @ExceptionHandler(VaultException.class)
    public ResponseEntity<ApiResponse<Void>> handleVaultException(VaultException e) {
        HttpStatus status = mapCategoryToHttpStatus(e.getCategory());
        if (e.getCategory() == VaultException.Category.EXTERNAL_FAILURE) {
            log.error("Vault operation aborted [{}]: {}", e.getErrorCode(), e.getMessage(), e);
        } else {
            log.warn("Vault operation rejected [{}]: {}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ApiResponse.error(e.getErrorCode().name(), e.getMessage()));
    }

    private HttpStatus mapCategoryToHttpStatus(VaultException.Category category) {
        return switch (category) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case INVARIANT_VIOLATION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INSUFFICIENT_STATE -> HttpStatus.CONFLICT;
            case EXTERNAL_FAILURE -> HttpStatus.BAD_GATEWAY;
            case ACCESS_DENIED -> HttpStatus.FORBIDDEN;
            case PAUSED -> HttpStatus.LOCKED;
        };
    }

    /**
     * Handles malformed JSON in request body.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleHttpMessageNotReadable(HttpMessageNotReadableException e) {
        log.warn("Malformed JSON request: {}", e.getMessage());
        return createErrorResponse(HttpStatus.BAD_REQUEST, MALFORMED_JSON_MESSAGE);
    }

    /**
     * Handles validation errors from @Valid annotations on request bodies.
     * Extracts the first validation error message for client feedback.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");

        log.warn("Validation error: {}", message);
        return createErrorResponse(HttpStatus.BAD_REQUEST, "Validation error: " + message);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing header: {}", e.getHeaderName());
        return createErrorResponse(HttpStatus.BAD_REQUEST, "Missing required header: " + e.getHeaderName());
    }

    /**
     * Handles type mismatch errors when request parameters cannot be converted.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatchException(MethodArgumentTypeMismatchException e) {
        String message = String.format("Invalid value '%s' for parameter '%s'", e.getValue(), e.getName());
        log.warn("Type mismatch: {}", message);
        return createErrorResponse(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return createErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * Handles IllegalStateException, e.g. a missing caller identity.
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalStateException(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return createErrorResponse(HttpStatus.CONFLICT, e.getMessage());
    }

    /**
     * Handles all uncaught exceptions as a safety net.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return createErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error: " + e.getMessage());
    }

    private static ResponseEntity<ApiResponse<Void>> createErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiResponse.error(message));
    }
}
