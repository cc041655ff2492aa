package com.phillippitts.resiliencecore.presentation.exception;

import com.phillippitts.resiliencecore.exception.CircuitOpenException;
import com.phillippitts.resiliencecore.exception.FallbackExhaustedException;
import com.phillippitts.resiliencecore.exception.RateLimitExceededException;
import com.phillippitts.resiliencecore.presentation.ratelimit.RateLimitHeaders;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping provider details away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Every model failed - transient, retry possible (HTTP 503).
     */
    @ExceptionHandler(FallbackExhaustedException.class)
    ResponseEntity<ApiError> handleFallbackExhausted(FallbackExhaustedException ex) {
        LOG.error("All models failed: attempted={}", ex.getAttemptedModels(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Service temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * A breaker refused a call made outside the router (HTTP 503).
     */
    @ExceptionHandler(CircuitOpenException.class)
    ResponseEntity<ApiError> handleCircuitOpen(CircuitOpenException ex) {
        LOG.warn("Circuit open: name={}, state={}", ex.getBreakerName(), ex.getState());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Service temporarily unavailable",
                "Dependency is recovering. Please retry later",
                Instant.now()
            ));
    }

    /**
     * Admission denied (HTTP 429) with rate-limit headers and Retry-After.
     */
    @ExceptionHandler(RateLimitExceededException.class)
    ResponseEntity<ApiError> handleRateLimitExceeded(RateLimitExceededException ex) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(RateLimitHeaders.LIMIT, String.valueOf(ex.getLimit()));
        headers.set(RateLimitHeaders.REMAINING, "0");
        headers.set(RateLimitHeaders.RESET, String.valueOf(ex.getResetSeconds()));
        headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getResetSeconds()));
        return ResponseEntity
            .status(HttpStatus.TOO_MANY_REQUESTS)
            .headers(headers)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Rate limit exceeded",
                "Limit is " + ex.getLimit() + " requests per " + ex.getWindowSeconds()
                    + "s. Retry after " + ex.getResetSeconds() + "s",
                Instant.now()
            ));
    }

    /**
     * Client error - invalid request body (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + " " + e.getDefaultMessage())
            .collect(Collectors.joining(", "));
        LOG.warn("Invalid request: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("ValidationError", "Invalid request", details, Instant.now()));
    }

    /**
     * Client error - invalid argument (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.warn("Invalid argument: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(ex.getClass().getSimpleName(), "Invalid request", ex.getMessage(), Instant.now()));
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
