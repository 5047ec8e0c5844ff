package com.phillippitts.mcphub.service.backend.anythingllm;

import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.domain.SearchRequest;
import com.phillippitts.mcphub.domain.SearchResults;
import com.phillippitts.mcphub.service.backend.BackendAdapter;
import org.springframework.stereotype.Component;

/**
 * {@code vector-search} backend served by the AnythingLLM workspace vector index.
 */
@Component
public class AnythingLlmSearchBackend implements BackendAdapter<SearchRequest, SearchResults> {

    public static final String NAME = "anythingllm-search";

    private final AnythingLlmClient client;

    public AnythingLlmSearchBackend(AnythingLlmClient client) {
        this.client = client;
    }

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
        return client.authenticated();
    }

    @Override
    public SearchResults invoke(SearchRequest input) {
        return new SearchResults(client.vectorSearch(NAME, input.query(), input.topK()));
    }
}
