package com.phillippitts.mcphub.domain;

import java.util.List;

/**
 * Output of the {@code vector-search} capability, ordered by descending score.
 */
public record SearchResults(List<SearchHit> hits) {

    public SearchResults {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }
}
