package com.phillippitts.mcphub.service.backend.anythingllm;

import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.domain.Completion;
import com.phillippitts.mcphub.domain.CompletionRequest;
import com.phillippitts.mcphub.service.backend.BackendAdapter;
import org.springframework.stereotype.Component;

/**
 * {@code llm-generate} backend served by an AnythingLLM workspace chat.
 */
@Component
public class AnythingLlmChatBackend implements BackendAdapter<CompletionRequest, Completion> {

    public static final String NAME = "anythingllm-chat";

    private final AnythingLlmClient client;

    public AnythingLlmChatBackend(AnythingLlmClient client) {
        this.client = client;
    }

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
        return client.authenticated();
    }

    @Override
    public Completion invoke(CompletionRequest input) {
        return new Completion(client.chat(NAME, input.prompt()));
    }
}
