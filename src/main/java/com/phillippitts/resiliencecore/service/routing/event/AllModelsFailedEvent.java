package com.phillippitts.resiliencecore.service.routing.event;

import java.time.Instant;
import java.util.List;

/** Published when no routing candidate succeeds. */
public record AllModelsFailedEvent(String capability, List<String> attempted, Instant at) { }
