package com.phillippitts.resiliencecore.service.circuit;

/**
 * Circuit breaker states. Allowed edges: CLOSED to OPEN, OPEN to HALF_OPEN,
 * HALF_OPEN to CLOSED, HALF_OPEN to OPEN, and any state to CLOSED on operator reset.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
