package com.phillippitts.mcphub.service.component;

import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.domain.SearchRequest;
import com.phillippitts.mcphub.domain.SearchResults;
import com.phillippitts.mcphub.service.graph.ExecutionContext;
import com.phillippitts.mcphub.service.graph.PipelineState;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Runs a vector search for {@code retrieval.query}, or for {@code chat.question} when no
 * explicit query was set.
 */
@Component
public class RetrieveContextComponent extends AbstractComponent {

    public static final String NAME = "retrieve_context";

    static final int DEFAULT_TOP_K = 4;

    public RetrieveContextComponent() {
        super(NAME, Set.of(StateKeys.CONTEXT_HITS, StateKeys.HAS_CONTEXT), Set.of(Capabilities.VECTOR_SEARCH));
    }

    @Override
    public Map<String, Object> run(PipelineState state, ExecutionContext ctx) {
        String query = state.contains(StateKeys.RETRIEVAL_QUERY) || !state.contains(StateKeys.QUESTION)
                ? state.requireString(StateKeys.RETRIEVAL_QUERY)
                : state.requireString(StateKeys.QUESTION);
        int topK = optionalInt(state, StateKeys.TOP_K, DEFAULT_TOP_K);
        SearchResults results = ctx.<SearchResults>invoke(Capabilities.VECTOR_SEARCH,
                new SearchRequest(query, topK)).output();
        return Map.of(StateKeys.CONTEXT_HITS, results.hits(), StateKeys.HAS_CONTEXT, !results.isEmpty());
    }
}
