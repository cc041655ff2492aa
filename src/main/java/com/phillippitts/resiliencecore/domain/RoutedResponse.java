package com.phillippitts.resiliencecore.domain;

import java.util.List;
import java.util.Objects;

/**
 * Successful router result.
 *
 * @param text      response text returned by the provider
 * @param modelName model that produced the response
 * @param tier      tier of that model
 * @param latencyMs wall time of the successful attempt
 * @param skipped   candidates tried and abandoned before this one
 */
public record RoutedResponse(String text, String modelName, int tier, long latencyMs, List<AttemptFailure> skipped) {

    public RoutedResponse {
        Objects.requireNonNull(modelName, "Model name must not be null");
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public boolean degraded() {
        return !skipped.isEmpty();
    }
}
