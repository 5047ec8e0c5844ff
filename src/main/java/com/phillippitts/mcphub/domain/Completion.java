package com.phillippitts.mcphub.domain;

import java.util.Objects;

/**
 * Output of the {@code llm-generate} capability.
 */
public record Completion(String text) {

    public Completion {
        Objects.requireNonNull(text, "text must not be null");
    }
}
