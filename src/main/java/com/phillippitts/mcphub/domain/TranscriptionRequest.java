package com.phillippitts.mcphub.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Input of the {@code transcribe-audio} capability.
 *
 * @param audioPath path to a WAV file readable by the hub process
 * @param language  language hint, or null to use the backend default
 */
public record TranscriptionRequest(Path audioPath, String language) {

    public TranscriptionRequest {
        Objects.requireNonNull(audioPath, "audioPath must not be null");
    }
}
