package com.phillippitts.mcphub.service.backend.mock;

import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.domain.SearchRequest;
import com.phillippitts.mcphub.domain.SearchResults;
import com.phillippitts.mcphub.service.backend.BackendAdapter;
import org.springframework.stereotype.Component;
import java.util.List;

/** Always-available vector-search fallback that finds nothing. */
@Component
public class MockSearchBackend implements BackendAdapter<SearchRequest, SearchResults> {

    public static final String NAME = "mock-search";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String capability() {
        return Capabilities.VECTOR_SEARCH;
    }

    @Override
    public boolean health() {
        return true;
    }

    @Override
    public SearchResults invoke(SearchRequest input) {
        return new SearchResults(List.of());
    }
}
