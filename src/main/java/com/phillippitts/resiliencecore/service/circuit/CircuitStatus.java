package com.phillippitts.resiliencecore.service.circuit;

/**
 * Immutable snapshot of a breaker for observability.
 *
 * @param failureRate failed calls as a percentage of all calls, rounded to two decimals
 */
public record CircuitStatus(
        String name,
        CircuitState state,
        long totalCalls,
        long successfulCalls,
        long failedCalls,
        int consecutiveFailures,
        double failureRate
) { }
