package com.phillippitts.mcphub.service.backend.whisper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Fake processes for whisper tests, so no real binary is spawned.
 */
final class FakeProcesses {

    private FakeProcesses() {}

    /**
     * @param finishAfterMillis delay before the process exits; -1 means it never exits on its own
     */
    record Script(String stdout, String stderr, int exitCode, long finishAfterMillis) {}

    /** Hands out one prepared process and remembers the command it was asked to run. */
    static final class RecordingFactory implements ProcessFactory {
        private final Process process;
        private final List<List<String>> commands = new ArrayList<>();

        RecordingFactory(Process process) {
            this.process = process;
        }

        @Override
        public Process start(List<String> command, Path workingDir) {
            commands.add(List.copyOf(command));
            return process;
        }

        List<String> lastCommand() {
            return commands.get(commands.size() - 1);
        }
    }

    static final class ScriptedProcess extends Process {
        private final Script script;
        private volatile boolean alive;
        private volatile boolean destroyed;

        ScriptedProcess(Script script) {
            this.script = script;
            this.alive = script.finishAfterMillis() != 0;
        }

        boolean wasDestroyed() {
            return destroyed;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(script.stdout().getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(script.stderr().getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public int waitFor() {
            alive = false;
            return script.exitCode();
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            long ms = unit.toMillis(timeout);
            long finish = script.finishAfterMillis();
            if (destroyed) {
                return true;
            }
            if (finish >= 0 && finish <= ms) {
                Thread.sleep(finish);
                alive = false;
                return true;
            }
            Thread.sleep(ms);
            return false;
        }

        @Override
        public int exitValue() {
            return script.exitCode();
        }

        @Override
        public void destroy() {
            destroyed = true;
            alive = false;
        }

        @Override
        public Process destroyForcibly() {
            destroy();
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
