package com.phillippitts.resiliencecore.service.circuit;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds for one circuit breaker.
 *
 * @param failureThreshold consecutive failures in CLOSED that open the circuit
 * @param successThreshold consecutive successes in HALF_OPEN that close it
 * @param timeout          cool-down after the last failure before probing
 * @param halfOpenMaxCalls probes allowed in flight while HALF_OPEN
 */
public record CircuitBreakerConfig(int failureThreshold, int successThreshold, Duration timeout,
                                   int halfOpenMaxCalls) {

    public static final CircuitBreakerConfig DEFAULT =
            new CircuitBreakerConfig(5, 3, Duration.ofSeconds(30), 3);

    public CircuitBreakerConfig {
        Objects.requireNonNull(timeout, "timeout");
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive, got: " + failureThreshold);
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException("successThreshold must be positive, got: " + successThreshold);
        }
        if (halfOpenMaxCalls <= 0) {
            throw new IllegalArgumentException("halfOpenMaxCalls must be positive, got: " + halfOpenMaxCalls);
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative, got: " + timeout);
        }
    }
}
