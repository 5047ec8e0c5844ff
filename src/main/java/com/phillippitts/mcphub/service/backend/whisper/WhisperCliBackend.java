package com.phillippitts.mcphub.service.backend.whisper;

import com.phillippitts.mcphub.config.properties.WhisperProperties;
import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.domain.Transcript;
import com.phillippitts.mcphub.domain.TranscriptionRequest;
import com.phillippitts.mcphub.exception.BackendExceptionBuilder;
import com.phillippitts.mcphub.service.backend.BackendAdapter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Transcription backend that shells out to a local whisper.cpp build.
 *
 * <p>Healthy when both the binary and the model file exist. Each invocation starts one
 * process; no model is kept resident.
 */
@Component
public class WhisperCliBackend implements BackendAdapter<TranscriptionRequest, Transcript> {

    public static final String NAME = "whisper-cli";

    private static final Logger LOG = LogManager.getLogger(WhisperCliBackend.class);

    // "[00:00:00.000 --> 00:00:02.500]   Hello there"
    private static final Pattern SEGMENT_TIMESTAMP = Pattern.compile("^\\[[^\\]]*-->[^\\]]*\\]\\s*");

    private final WhisperProperties cfg;
    private final WhisperProcessRunner runner;

    @Autowired
    public WhisperCliBackend(WhisperProperties cfg) {
        this(cfg, new WhisperProcessRunner(NAME));
    }

    WhisperCliBackend(WhisperProperties cfg, WhisperProcessRunner runner) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

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
        Path binary = WhisperProcessRunner.resolvePath(cfg.binaryPath());
        Path model = WhisperProcessRunner.resolvePath(cfg.modelPath());
        boolean ok = Files.isRegularFile(binary) && Files.isRegularFile(model);
        if (!ok) {
            LOG.debug("whisper-cli unavailable: binary={} exists={}, model={} exists={}",
                    binary, Files.isRegularFile(binary), model, Files.isRegularFile(model));
        }
        return ok;
    }

    @Override
    public Transcript invoke(TranscriptionRequest input) {
        Objects.requireNonNull(input, "input");
        if (!Files.isReadable(input.audioPath())) {
            throw BackendExceptionBuilder.create("Audio file not readable")
                    .backend(NAME)
                    .metadata("audioPath", input.audioPath())
                    .build();
        }
        String stdout = runner.run(input.audioPath(), input.language(), cfg);
        String language = input.language() == null ? cfg.language() : input.language();
        return new Transcript(cleanOutput(stdout), language);
    }

    /**
     * Joins whisper's text output into one line per segment without timestamp prefixes.
     */
    static String cleanOutput(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String line : stdout.split("\\R")) {
            String text = SEGMENT_TIMESTAMP.matcher(line).replaceFirst("").trim();
            if (text.isEmpty()) {
                continue;
            }
            if (!sb.isEmpty()) {
                sb.append(' ');
            }
            sb.append(text);
        }
        return sb.toString();
    }
}
