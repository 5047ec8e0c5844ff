package com.phillippitts.mcphub.service.component;

import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.domain.CapabilityResult;
import com.phillippitts.mcphub.domain.Transcript;
import com.phillippitts.mcphub.domain.TranscriptionRequest;
import com.phillippitts.mcphub.service.graph.ExecutionContext;
import com.phillippitts.mcphub.service.graph.PipelineState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Turns {@code meeting.audio_path} into {@code meeting.transcript}.
 */
@Component
public class TranscribeComponent extends AbstractComponent {
    private static final Logger LOG = LogManager.getLogger(TranscribeComponent.class);

    public static final String NAME = "transcribe";

    public TranscribeComponent() {
        super(NAME, Set.of(StateKeys.TRANSCRIPT), Set.of(Capabilities.TRANSCRIBE_AUDIO));
    }

    @Override
    public Map<String, Object> run(PipelineState state, ExecutionContext ctx) {
        Path audio = Path.of(state.requireString(StateKeys.AUDIO_PATH));
        String language = optionalString(state, StateKeys.LANGUAGE, null);
        CapabilityResult<Transcript> result = ctx.invoke(Capabilities.TRANSCRIBE_AUDIO,
                new TranscriptionRequest(audio, language));
        LOG.info("Transcribed {} via {} (chars={})", audio.getFileName(), result.backend(),
                result.output().text().length());
        return Map.of(StateKeys.TRANSCRIPT, result.output().text());
    }
}
