/**
 * Local whisper.cpp transcription backend.
 *
 * <p>{@link com.phillippitts.mcphub.service.backend.whisper.WhisperCliBackend} serves the
 * {@code transcribe-audio} capability by running the binary through
 * {@link com.phillippitts.mcphub.service.backend.whisper.WhisperProcessRunner}, which owns the
 * subprocess lifecycle (stream capture, timeout, forced termination).
 */
package com.phillippitts.mcphub.service.backend.whisper;
