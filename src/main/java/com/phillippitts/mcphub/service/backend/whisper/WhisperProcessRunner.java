package com.phillippitts.mcphub.service.backend.whisper;

import com.phillippitts.mcphub.config.properties.WhisperProperties;
import com.phillippitts.mcphub.exception.BackendException;
import com.phillippitts.mcphub.exception.BackendExceptionBuilder;
import com.phillippitts.mcphub.exception.ErrorKind;
import com.phillippitts.mcphub.util.ProcessTimeouts;
import com.phillippitts.mcphub.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one whisper.cpp process per call and returns its stdout.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Build the CLI from {@link WhisperProperties}</li>
 *   <li>Capture stdout and stderr concurrently with byte caps</li>
 *   <li>Enforce the timeout and terminate runaway processes</li>
 *   <li>Report failures as {@link BackendException} with exit code, duration and stderr</li>
 * </ul>
 *
 * <p>All per-run state is local to {@link #run}, so concurrent calls from different tasks
 * do not interfere.
 */
public final class WhisperProcessRunner {

    private static final Logger LOG = LogManager.getLogger(WhisperProcessRunner.class);

    static final int STDERR_MAX_BYTES = 256 * 1024;
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    private final ProcessFactory processFactory;
    private final String backendName;

    private record Execution(Process process, Thread outReader, Thread errReader,
                             StringBuilder stdout, StringBuilder stderr) {
    }

    public WhisperProcessRunner(String backendName) {
        this(new DefaultProcessFactory(), backendName);
    }

    public WhisperProcessRunner(ProcessFactory processFactory, String backendName) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.backendName = Objects.requireNonNull(backendName, "backendName");
    }

    /**
     * Executes whisper.cpp for the given WAV file.
     *
     * <p>CLI contract:
     * <pre>
     * ${binary} -m ${model} -f ${wav} -l ${language} -otxt -of stdout -t ${threads}
     * </pre>
     *
     * @param wavPath  audio file
     * @param language language code, or null for the configured default
     * @param cfg      whisper settings
     * @return stdout produced by whisper (may be empty)
     * @throws BackendException on timeout, non-zero exit or I/O error
     */
    public String run(Path wavPath, String language, WhisperProperties cfg) {
        Objects.requireNonNull(wavPath, "wavPath");
        Objects.requireNonNull(cfg, "cfg");

        List<String> command = buildCommand(cfg, wavPath, language);
        long startTime = System.nanoTime();
        Execution exec = null;
        try {
            exec = start(command, wavPath, cfg);
            boolean finished = exec.process().waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                destroyProcess(exec.process());
                throw failure("Timeout after " + cfg.timeoutSeconds() + "s", ErrorKind.BACKEND_TIMEOUT,
                        -1, exec.stderr(), startTime, null, cfg);
            }
            joinQuietly(exec.outReader(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(exec.errReader(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            if (exitCode != 0) {
                throw failure("Non-zero exit: " + exitCode, ErrorKind.BACKEND_INVOCATION_ERROR,
                        exitCode, exec.stderr(), startTime, null, cfg);
            }
            String output = exec.stdout().toString();
            LOG.debug("Whisper stdout size={} chars, took {} ms", output.length(), TimeUtils.elapsedMillis(startTime));
            return output;
        } catch (IOException e) {
            throw failure("I/O failure: " + e.getMessage(), ErrorKind.BACKEND_INVOCATION_ERROR,
                    -1, null, startTime, e, cfg);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("Interrupted while waiting for whisper", ErrorKind.BACKEND_INVOCATION_ERROR,
                    -1, null, startTime, e, cfg);
        } finally {
            if (exec != null && exec.process().isAlive()) {
                destroyProcess(exec.process());
            }
        }
    }

    List<String> buildCommand(WhisperProperties cfg, Path wavPath, String language) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(cfg.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(resolvePath(cfg.modelPath()).toString());
        cmd.add("-f");
        cmd.add(wavPath.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(language == null || language.isBlank() ? cfg.language() : language);
        cmd.add("-otxt");
        cmd.add("-of");
        cmd.add("stdout");
        cmd.add("-t");
        cmd.add(String.valueOf(cfg.threads()));
        return cmd;
    }

    static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }

    private Execution start(List<String> command, Path wavPath, WhisperProperties cfg) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Path workDir = wavPath.toAbsolutePath().getParent();
        Process process = processFactory.start(command, workDir);
        // Readers start before waitFor so a full pipe cannot block the child.
        Thread out = startReader(process.getInputStream(), stdout, backendName + "-out", cfg.maxStdoutBytes());
        Thread err = startReader(process.getErrorStream(), stderr, backendName + "-err", STDERR_MAX_BYTES);
        return new Execution(process, out, err, stdout, stderr);
    }

    private Thread startReader(InputStream in, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new CappedStreamReader(in, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a buffer until the cap is reached, then keeps draining without storing.
     */
    private static final class CappedStreamReader implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        CappedStreamReader(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        if (line.length() > available) {
                            sink.append(line, 0, Math.max(0, available));
                            capReached = true;
                        } else {
                            sink.append(line);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream reader '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        }
    }

    private BackendException failure(String msg, ErrorKind kind, int exitCode, StringBuilder stderr,
                                     long startNano, Throwable cause, WhisperProperties cfg) {
        String stderrSnippet;
        if (stderr == null) {
            stderrSnippet = "";
        } else {
            synchronized (stderr) {
                stderrSnippet = stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length()));
            }
        }
        BackendExceptionBuilder builder = BackendExceptionBuilder.create(msg)
                .backend(backendName)
                .kind(kind)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNano))
                .metadata("binaryPath", cfg.binaryPath())
                .metadata("stderr", stderrSnippet);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }
}
