package com.phillippitts.resiliencecore.presentation.exception;

import com.phillippitts.resiliencecore.domain.AttemptFailure;
import com.phillippitts.resiliencecore.exception.CircuitOpenException;
import com.phillippitts.resiliencecore.exception.FallbackExhaustedException;
import com.phillippitts.resiliencecore.exception.RateLimitExceededException;
import com.phillippitts.resiliencecore.service.circuit.CircuitState;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapExhaustedFallbackTo503WithoutProviderDetails() {
        FallbackExhaustedException ex = new FallbackExhaustedException("All models failed",
                List.of(new AttemptFailure("gemini-pro", "timeout", null)), null);

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleFallbackExhausted(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("FallbackExhaustedException");
        assertThat(response.getBody().message()).isEqualTo("Service temporarily unavailable");
        assertThat(response.getBody().details()).doesNotContain("gemini-pro");
    }

    @Test
    void shouldMapOpenCircuitTo503() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleCircuitOpen(
                new CircuitOpenException("search", CircuitState.OPEN, "cooling down"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void shouldMapRateLimitTo429WithRetryAfter() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleRateLimitExceeded(new RateLimitExceededException(30, 12, 60));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        HttpHeaders headers = response.getHeaders();
        assertThat(headers.getFirst("X-RateLimit-Limit")).isEqualTo("30");
        assertThat(headers.getFirst("X-RateLimit-Remaining")).isEqualTo("0");
        assertThat(headers.getFirst("X-RateLimit-Reset")).isEqualTo("12");
        assertThat(headers.getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("12");
        assertThat(response.getBody().details()).contains("30 requests per 60s");
    }

    @Test
    void shouldMapIllegalArgumentTo400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleIllegalArgument(new IllegalArgumentException("ttl must be positive"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().details()).isEqualTo("ttl must be positive");
    }

    @Test
    void shouldHideUnexpectedErrors() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("secret internals"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().details()).doesNotContain("secret");
    }
}
