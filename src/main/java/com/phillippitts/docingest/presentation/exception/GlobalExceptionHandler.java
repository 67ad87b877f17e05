package com.phillippitts.docingest.presentation.exception;

import com.phillippitts.docingest.exception.AuthFailureException;
import com.phillippitts.docingest.exception.BatchNotFoundException;
import com.phillippitts.docingest.exception.InvalidFileException;
import com.phillippitts.docingest.exception.ResolutionNotFoundException;
import com.phillippitts.docingest.exception.TransferException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping server payloads and file contents away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - file cannot be ingested (HTTP 400).
     */
    @ExceptionHandler(InvalidFileException.class)
    ResponseEntity<ApiError> handleInvalidFile(InvalidFileException ex) {
        LOG.warn("Invalid file: reason={}", ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid file", ex.getMessage());
    }

    /**
     * Client error - malformed request (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.debug("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", ex.getMessage());
    }

    /**
     * Backend refused the credential (HTTP 401).
     */
    @ExceptionHandler(AuthFailureException.class)
    ResponseEntity<ApiError> handleAuthFailure(AuthFailureException ex) {
        LOG.warn("Backend rejected credential during {}", ex.getOperation());
        return error(HttpStatus.UNAUTHORIZED, ex, "Authentication required",
                "Re-authenticate and resubmit");
    }

    @ExceptionHandler({BatchNotFoundException.class, ResolutionNotFoundException.class})
    ResponseEntity<ApiError> handleNotFound(RuntimeException ex) {
        return error(HttpStatus.NOT_FOUND, ex, "Not found", ex.getMessage());
    }

    /**
     * Request conflicts with the current state, e.g. deciding on a resolved request (HTTP 409).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleConflict(IllegalStateException ex) {
        LOG.debug("Conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex, "Conflict with current state", ex.getMessage());
    }

    /**
     * Backend unreachable or failing (HTTP 502).
     */
    @ExceptionHandler(TransferException.class)
    ResponseEntity<ApiError> handleBackendFailure(TransferException ex) {
        LOG.error("Backend call failed: operation={}, httpStatus={}", ex.getOperation(), ex.getHttpStatus(), ex);
        return error(HttpStatus.BAD_GATEWAY, ex, "Document backend unavailable", "Please retry later");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
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
