package com.phillippitts.resiliencecore.exception;

import com.phillippitts.resiliencecore.service.circuit.CircuitState;

/**
 * Thrown when a circuit breaker refuses a call without invoking the protected handler.
 * Distinct from {@link HandlerFailureException} so callers can tell "upstream failed"
 * apart from "we never tried".
 */
public class CircuitOpenException extends AssistantCoreException {

    private final String breakerName;
    private final CircuitState state;

    public CircuitOpenException(String breakerName, CircuitState state, String reason) {
        super("Circuit '" + breakerName + "' rejected call (state=" + state + "): " + reason);
        this.breakerName = breakerName;
        this.state = state;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public CircuitState getState() {
        return state;
    }
}
