package com.phillippitts.resiliencecore.domain;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable routing configuration for one upstream model.
 *
 * @param name            unique model name, also used for the breaker name {@code model:<name>}
 * @param tier            ordinal priority; lower tier is preferred
 * @param provider        provider whose handler serves this model
 * @param modelId         provider-specific model identifier
 * @param maxTokens       default response token cap
 * @param temperature     default sampling temperature
 * @param timeout         per-call timeout
 * @param costPer1kTokens approximate cost per 1000 tokens (input plus output)
 * @param capabilities    advertised capabilities; empty means "supports everything"
 */
public record ModelConfig(
        String name,
        int tier,
        ProviderType provider,
        String modelId,
        int maxTokens,
        double temperature,
        Duration timeout,
        double costPer1kTokens,
        Set<String> capabilities
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final double DEFAULT_TEMPERATURE = 0.7;

    public ModelConfig {
        Objects.requireNonNull(name, "Model name must not be null");
        Objects.requireNonNull(provider, "Provider must not be null");
        Objects.requireNonNull(modelId, "Model id must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Model name must not be blank");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got: " + maxTokens);
        }
        if (costPer1kTokens < 0) {
            throw new IllegalArgumentException("costPer1kTokens must not be negative, got: " + costPer1kTokens);
        }
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    /**
     * Returns true when this model advertises the capability, or advertises none at all.
     */
    public boolean supports(String capability) {
        return capabilities.isEmpty() || capabilities.contains(capability);
    }

    /** Name of the circuit breaker guarding this model. */
    public String circuitName() {
        return "model:" + name;
    }
}
