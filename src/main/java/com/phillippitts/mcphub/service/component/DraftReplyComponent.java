package com.phillippitts.mcphub.service.component;

import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.domain.MailMessage;
import com.phillippitts.mcphub.service.graph.ExecutionContext;
import com.phillippitts.mcphub.service.graph.PipelineState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drafts a reply to the newest synced message, grounded on retrieved context.
 */
@Component
public class DraftReplyComponent extends AbstractComponent {

    public static final String NAME = "draft_reply";

    static final String PROMPT = """
            Draft a concise, professional reply to the email below.
            Use the reference material where it is relevant; do not invent facts.

            From: %s
            Subject: %s

            %s

            Reference material:
            %s
            """;

    public DraftReplyComponent() {
        super(NAME, Set.of(StateKeys.REPLY_DRAFT), Set.of(Capabilities.LLM_GENERATE));
    }

    @Override
    public Map<String, Object> run(PipelineState state, ExecutionContext ctx) {
        List<?> messages = state.require(StateKeys.MESSAGES, List.class);
        if (messages.isEmpty() || !(messages.get(0) instanceof MailMessage newest)) {
            throw new IllegalStateException("No message to reply to in " + StateKeys.MESSAGES);
        }
        List<?> hits = state.get(StateKeys.CONTEXT_HITS).map(List.class::cast).orElse(List.of());
        String draft = complete(ctx, PROMPT.formatted(newest.from(), newest.subject(),
                newest.body() == null ? "" : newest.body(), ContextFormatter.format(hits)));
        return Map.of(StateKeys.REPLY_DRAFT, draft);
    }
}
