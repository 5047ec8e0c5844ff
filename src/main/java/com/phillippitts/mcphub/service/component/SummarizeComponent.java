package com.phillippitts.mcphub.service.component;

import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.service.graph.ExecutionContext;
import com.phillippitts.mcphub.service.graph.PipelineState;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Summarizes {@code meeting.transcript} and extracts action items and participants.
 * Always writes {@code meeting.has_action_items}, which meeting graphs branch on.
 */
@Component
public class SummarizeComponent extends AbstractComponent {

    public static final String NAME = "summarize";

    static final String PROMPT = """
            Summarize the following meeting transcript. Answer in exactly this layout:

            ## Summary
            <a few sentences covering the main points and decisions>

            ## Action Items
            - <one action item per line, owner first if known>

            ## Participants
            - <one participant per line, if identifiable>

            Transcript:
            %s
            """;

    public SummarizeComponent() {
        super(NAME, Set.of(StateKeys.SUMMARY, StateKeys.ACTION_ITEMS, StateKeys.PARTICIPANTS,
                StateKeys.HAS_ACTION_ITEMS), Set.of(Capabilities.LLM_GENERATE));
    }

    @Override
    public Map<String, Object> run(PipelineState state, ExecutionContext ctx) {
        String transcript = state.requireString(StateKeys.TRANSCRIPT);
        SummaryParser.MeetingSummary parsed = SummaryParser.parse(complete(ctx, PROMPT.formatted(transcript)));

        Map<String, Object> update = new LinkedHashMap<>();
        update.put(StateKeys.SUMMARY, parsed.summary());
        update.put(StateKeys.ACTION_ITEMS, parsed.actionItems());
        update.put(StateKeys.PARTICIPANTS, parsed.participants());
        update.put(StateKeys.HAS_ACTION_ITEMS, !parsed.actionItems().isEmpty());
        return update;
    }
}
