package com.phillippitts.mcphub.util;

import java.time.Duration;

/**
 * Timeout values for subprocess and stream-reader lifecycle management.
 *
 * <p>The constants bound how long a call may spend cleaning up after the subprocess has
 * finished or been abandoned. They apply after {@code mcp.backends.whisper.timeout-seconds}, so a timed
 * out call returns within that timeout plus {@link #GRACEFUL_SHUTDOWN_TIMEOUT} plus
 * {@link #FORCEFUL_SHUTDOWN_TIMEOUT}.
 *
 * <p><b>Usage:</b> Used by
 * {@link com.phillippitts.mcphub.service.backend.whisper.WhisperProcessRunner} for the
 * subprocess and its stdout/stderr reader threads.
 *
 * @see com.phillippitts.mcphub.service.backend.whisper.WhisperProcessRunner
 * @since 0.1
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream reader threads to flush buffered output after process completion.
     *
     * <p>Readers keep draining past their byte cap, so a reader still alive after this
     * window is blocked on a stream the process has not closed. Its partial buffer is used
     * as is; the thread is a daemon and does not hold up shutdown.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     *
     * <p>On Unix this sends SIGTERM; the runner escalates to a forced kill when the process
     * is still alive afterwards.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful termination via {@link Process#destroyForcibly()}.
     *
     * <p>A process still alive after this is logged and left to the OS.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
