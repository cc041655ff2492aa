package com.phillippitts.resiliencecore.domain;

import java.util.Objects;

/**
 * Provider-agnostic completion request.
 *
 * @param prompt       user prompt (must not be null)
 * @param systemPrompt optional system prompt
 * @param temperature  optional override of the model's default temperature
 * @param maxTokens    optional override of the model's default token cap
 */
public record ModelRequest(String prompt, String systemPrompt, Double temperature, Integer maxTokens) {

    public ModelRequest {
        Objects.requireNonNull(prompt, "Prompt must not be null");
    }

    public static ModelRequest of(String prompt) {
        return new ModelRequest(prompt, null, null, null);
    }

    /** Number of characters the request sends upstream, used for token estimates. */
    public int inputLength() {
        return prompt.length() + (systemPrompt == null ? 0 : systemPrompt.length());
    }
}
