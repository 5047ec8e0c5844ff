package com.phillippitts.mcphub.service.task;

import com.phillippitts.mcphub.domain.CompletionRequest;
import com.phillippitts.mcphub.domain.MailSyncRequest;
import com.phillippitts.mcphub.domain.SearchRequest;
import com.phillippitts.mcphub.domain.TranscriptionRequest;
import com.phillippitts.mcphub.exception.MissingStateKeyException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapabilityPayloadsTest {

    @Test
    void buildsTypedInputsWithDefaults() {
        assertThat(CapabilityPayloads.toInput("transcribe-audio", Map.of("audioPath", "/tmp/a.wav")))
                .isEqualTo(new TranscriptionRequest(Path.of("/tmp/a.wav"), null));
        assertThat(CapabilityPayloads.toInput("vector-search", Map.of("query", "q")))
                .isEqualTo(new SearchRequest("q", 4));
        assertThat(CapabilityPayloads.toInput("mail-sync", Map.of()))
                .isEqualTo(new MailSyncRequest("INBOX", 10));
        assertThat(CapabilityPayloads.toInput("llm-generate", Map.of("prompt", "p", "maxTokens", 50)))
                .isInstanceOfSatisfying(CompletionRequest.class, r -> {
                    assertThat(r.prompt()).isEqualTo("p");
                    assertThat(r.maxTokens()).isEqualTo(50);
                });
    }

    @Test
    void unknownCapabilityReceivesRawPayload() {
        Map<String, Object> payload = Map.of("anything", 1);

        assertThat(CapabilityPayloads.toInput("custom", payload)).isSameAs(payload);
    }

    @Test
    void missingRequiredKeyIsReported() {
        assertThatThrownBy(() -> CapabilityPayloads.toInput("vector-search", Map.of()))
                .isInstanceOf(MissingStateKeyException.class)
                .hasMessageContaining("query");
    }
}
