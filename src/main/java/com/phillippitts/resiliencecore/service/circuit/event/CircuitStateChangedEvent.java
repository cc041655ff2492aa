package com.phillippitts.resiliencecore.service.circuit.event;

import com.phillippitts.resiliencecore.service.circuit.CircuitState;

import java.time.Instant;

/** Published whenever a breaker moves between states. */
public record CircuitStateChangedEvent(String circuit, CircuitState from, CircuitState to, Instant at) { }
