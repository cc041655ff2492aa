package com.phillippitts.resiliencecore.service.routing.event;

import java.time.Instant;

/** Published when a routing candidate fails and the router moves on to the next tier. */
public record ModelFallbackEvent(String model, String reason, Instant at) { }
