package com.phillippitts.mcphub.domain;

import java.util.Objects;

/**
 * Input of the {@code llm-generate} capability.
 *
 * @param prompt      full prompt text
 * @param maxTokens   upper bound on generated tokens
 * @param temperature sampling temperature between 0.0 and 2.0
 */
public record CompletionRequest(String prompt, int maxTokens, double temperature) {

    public CompletionRequest {
        Objects.requireNonNull(prompt, "prompt must not be null");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got: " + maxTokens);
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be between 0.0 and 2.0, got: " + temperature);
        }
    }

    public static CompletionRequest of(String prompt) {
        return new CompletionRequest(prompt, 1024, 0.2);
    }
}
