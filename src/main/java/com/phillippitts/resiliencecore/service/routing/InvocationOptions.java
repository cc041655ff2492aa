package com.phillippitts.resiliencecore.service.routing;

import com.phillippitts.resiliencecore.domain.ModelConfig;
import com.phillippitts.resiliencecore.domain.ModelRequest;

import java.time.Duration;

/**
 * Limits applied to one provider call: request overrides capped by the model's configuration.
 */
public record InvocationOptions(int maxTokens, double temperature, Duration timeout) {

    static InvocationOptions resolve(ModelConfig model, ModelRequest request) {
        int maxTokens = request.maxTokens() == null
                ? model.maxTokens()
                : Math.min(request.maxTokens(), model.maxTokens());
        double temperature = request.temperature() == null ? model.temperature() : request.temperature();
        return new InvocationOptions(maxTokens, temperature, model.timeout());
    }
}
