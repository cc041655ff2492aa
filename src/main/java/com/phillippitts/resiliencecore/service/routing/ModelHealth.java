package com.phillippitts.resiliencecore.service.routing;

import com.phillippitts.resiliencecore.domain.ProviderType;
import com.phillippitts.resiliencecore.service.circuit.CircuitState;

/**
 * Routing health of one model.
 *
 * @param available true when a handler is registered and the breaker would admit a call
 */
public record ModelHealth(int tier, ProviderType provider, CircuitState circuitState, boolean available) { }
