package com.phillippitts.mcphub.service.backend.mock;

import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.domain.Transcript;
import com.phillippitts.mcphub.domain.TranscriptionRequest;
import com.phillippitts.mcphub.service.backend.BackendAdapter;
import org.springframework.stereotype.Component;

/**
 * Always-available transcription fallback. Returns a placeholder transcript naming the file
 * so downstream components still run.
 */
@Component
public class MockTranscriptionBackend implements BackendAdapter<TranscriptionRequest, Transcript> {

    public static final String NAME = "mock-transcribe";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String capability() {
        return Capabilities.TRANSCRIBE_AUDIO;
    }

    @Override
    public boolean health() {
        return true;
    }

    @Override
    public Transcript invoke(TranscriptionRequest input) {
        String file = input.audioPath().getFileName() == null ? "audio" : input.audioPath().getFileName().toString();
        return new Transcript("[transcription unavailable for " + file + "]", input.language());
    }
}
