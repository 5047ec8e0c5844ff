package com.phillippitts.mcphub.service.backend.mock;

import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.domain.Completion;
import com.phillippitts.mcphub.domain.CompletionRequest;
import com.phillippitts.mcphub.service.backend.BackendAdapter;
import org.springframework.stereotype.Component;

/**
 * Always-available language-model fallback. Echoes a short, deterministic answer in the
 * markdown layout the summarizer understands.
 */
@Component
public class MockCompletionBackend implements BackendAdapter<CompletionRequest, Completion> {

    public static final String NAME = "mock-llm";

    static final int ECHO_CHARS = 160;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String capability() {
        return Capabilities.LLM_GENERATE;
    }

    @Override
    public boolean health() {
        return true;
    }

    @Override
    public Completion invoke(CompletionRequest input) {
        String prompt = input.prompt().strip();
        String head = prompt.length() <= ECHO_CHARS ? prompt : prompt.substring(0, ECHO_CHARS) + "...";
        return new Completion("## Summary\n"
                + "Language model unavailable; showing the request excerpt.\n\n"
                + "> " + head.replace("\n", " ") + "\n\n"
                + "## Action Items\n\n"
                + "## Participants\n");
    }
}
