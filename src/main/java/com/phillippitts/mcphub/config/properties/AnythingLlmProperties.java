package com.phillippitts.mcphub.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for a remote AnythingLLM instance.
 * Binds to properties prefixed with "mcp.backends.anythingllm".
 *
 * @param baseUrl          API root, e.g. {@code http://localhost:3001/api}
 * @param apiKey           bearer token; blank makes the backends report unhealthy
 * @param workspace        workspace slug used for chat and vector search
 * @param chatMode         {@code chat} or {@code query}
 * @param connectTimeoutMs TCP connect timeout
 * @param requestTimeoutMs per-request timeout
 */
@ConfigurationProperties(prefix = "mcp.backends.anythingllm")
@Validated
public record AnythingLlmProperties(
        @NotBlank(message = "AnythingLLM base URL must not be blank")
        String baseUrl,

        String apiKey,

        @NotBlank(message = "AnythingLLM workspace must not be blank")
        String workspace,

        @NotBlank(message = "Chat mode must not be blank")
        String chatMode,

        @Positive(message = "Connect timeout must be positive")
        int connectTimeoutMs,

        @Positive(message = "Request timeout must be positive")
        int requestTimeoutMs
) {
    public AnythingLlmProperties() {
        this("http://localhost:3001/api", "", "default", "chat", 2000, 60000);
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
