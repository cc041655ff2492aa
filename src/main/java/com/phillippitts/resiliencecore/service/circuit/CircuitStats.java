package com.phillippitts.resiliencecore.service.circuit;

import java.time.Instant;

/** Mutable call counters. Only the owning breaker touches them, under its lock. */
final class CircuitStats {
    long totalCalls;
    long successfulCalls;
    long failedCalls;
    int consecutiveFailures;
    int consecutiveSuccesses;
    Instant lastFailureTime;

    double failureRate() {
        if (totalCalls == 0) {
            return 0.0;
        }
        return Math.round(failedCalls * 10_000.0 / totalCalls) / 100.0;
    }
}
