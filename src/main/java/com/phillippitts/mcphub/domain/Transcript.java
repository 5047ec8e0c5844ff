package com.phillippitts.mcphub.domain;

import java.util.Objects;

/**
 * Output of the {@code transcribe-audio} capability.
 * Empty text is valid; silence may produce no words.
 *
 * @param text     transcribed text
 * @param language detected or requested language, may be null
 */
public record Transcript(String text, String language) {

    public Transcript {
        Objects.requireNonNull(text, "Transcript text must not be null");
    }
}
