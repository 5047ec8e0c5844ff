package com.phillippitts.mcphub.service.component;

import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.service.graph.ExecutionContext;
import com.phillippitts.mcphub.service.graph.PipelineState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drafts a follow-up message from the meeting summary and its action items.
 */
@Component
public class DraftFollowupComponent extends AbstractComponent {

    public static final String NAME = "draft_followup";

    static final String PROMPT = """
            Write a short, friendly follow-up email to the meeting participants.
            Recap the summary and list every action item with its owner.

            Summary:
            %s

            Action items:
            %s
            """;

    public DraftFollowupComponent() {
        super(NAME, Set.of(StateKeys.FOLLOWUP_DRAFT), Set.of(Capabilities.LLM_GENERATE));
    }

    @Override
    public Map<String, Object> run(PipelineState state, ExecutionContext ctx) {
        String summary = state.requireString(StateKeys.SUMMARY);
        List<?> items = state.require(StateKeys.ACTION_ITEMS, List.class);
        StringBuilder bullets = new StringBuilder();
        for (Object item : items) {
            bullets.append("- ").append(item).append('\n');
        }
        String draft = complete(ctx, PROMPT.formatted(summary, bullets));
        return Map.of(StateKeys.FOLLOWUP_DRAFT, draft);
    }
}
