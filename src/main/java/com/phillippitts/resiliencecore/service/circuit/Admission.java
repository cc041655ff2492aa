package com.phillippitts.resiliencecore.service.circuit;

/**
 * Result of asking a breaker whether a call may proceed.
 *
 * <p>Either admitted, possibly as a half-open probe, or rejected with a reason.
 * The probe generation ties a probe to the HALF_OPEN episode that admitted it.
 */
record Admission(boolean admitted, CircuitState state, String reason, boolean probe, long generation) {

    static Admission admitted(CircuitState state) {
        return new Admission(true, state, null, false, 0L);
    }

    static Admission probe(long generation) {
        return new Admission(true, CircuitState.HALF_OPEN, null, true, generation);
    }

    static Admission rejected(CircuitState state, String reason) {
        return new Admission(false, state, reason, false, 0L);
    }
}
