package com.phillippitts.mcphub.service.component;

import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.service.graph.ExecutionContext;
import com.phillippitts.mcphub.service.graph.PipelineState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Answers {@code chat.question} from retrieved knowledge-base excerpts.
 */
@Component
public class AnswerQuestionComponent extends AbstractComponent {

    public static final String NAME = "answer_question";

    static final String PROMPT = """
            Answer the question using the excerpts below. Cite excerpts by their number.
            If the excerpts do not contain the answer, say so.

            Excerpts:
            %s

            Question: %s
            """;

    public AnswerQuestionComponent() {
        super(NAME, Set.of(StateKeys.ANSWER), Set.of(Capabilities.LLM_GENERATE));
    }

    @Override
    public Map<String, Object> run(PipelineState state, ExecutionContext ctx) {
        String question = state.requireString(StateKeys.QUESTION);
        List<?> hits = state.get(StateKeys.CONTEXT_HITS).map(List.class::cast).orElse(List.of());
        return Map.of(StateKeys.ANSWER, complete(ctx, PROMPT.formatted(ContextFormatter.format(hits), question)));
    }
}
