package com.phillippitts.mcphub.domain;

import java.util.Objects;

/**
 * Input of the {@code vector-search} capability.
 */
public record SearchRequest(String query, int topK) {

    public SearchRequest {
        Objects.requireNonNull(query, "query must not be null");
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, got: " + topK);
        }
    }
}
