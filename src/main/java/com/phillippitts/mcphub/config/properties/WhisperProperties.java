package com.phillippitts.mcphub.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the local whisper.cpp transcription backend.
 * Binds to properties prefixed with "mcp.backends.whisper".
 *
 * <p>Example application.properties:
 * <pre>
 * mcp.backends.whisper.binary-path=tools/whisper.cpp/main
 * mcp.backends.whisper.model-path=models/ggml-base.en.bin
 * mcp.backends.whisper.timeout-seconds=120
 * mcp.backends.whisper.language=en
 * mcp.backends.whisper.threads=4
 * mcp.backends.whisper.max-stdout-bytes=1048576
 * </pre>
 *
 * @param binaryPath     path to the whisper.cpp binary
 * @param modelPath      path to the GGML model file
 * @param timeoutSeconds hard limit on one process run
 * @param language       default language code when a request does not name one
 * @param threads        CPU threads handed to whisper.cpp
 * @param maxStdoutBytes cap on captured stdout
 */
@ConfigurationProperties(prefix = "mcp.backends.whisper")
@Validated
public record WhisperProperties(
        @NotBlank(message = "Whisper binary path must not be blank")
        String binaryPath,

        @NotBlank(message = "Whisper model path must not be blank")
        String modelPath,

        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @NotBlank(message = "Language code must not be blank")
        String language,

        @Positive(message = "Thread count must be positive")
        int threads,

        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes
) {
    public WhisperProperties() {
        this("tools/whisper.cpp/main", "models/ggml-base.en.bin", 120, "en", 4, 1048576);
    }
}
