package com.phillippitts.dialogaugment.service.transform.synthesis;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Shared test doubles for synthesis process tests.
 * Provides fake Process implementations for hermetic testing without a real TTS binary.
 */
final class SynthesisTestDoubles {

    private SynthesisTestDoubles() {}

    /**
     * Encapsulates test process behavior configuration.
     *
     * @param stdout stdout content to return
     * @param stderr stderr content to return
     * @param exitCode process exit code
     * @param finishAfterMillis delay before process finishes (-1 means never finish)
     */
    record ProcessBehavior(String stdout, String stderr, int exitCode, long finishAfterMillis) {}

    /**
     * Stub ProcessFactory that returns a pre-configured Process and, like the real tool,
     * optionally writes audio bytes to the {@code --out_path} argument.
     */
    static final class StubProcessFactory implements ProcessFactory {
        private final Process p;
        private final byte[] audio;
        private volatile List<String> lastCommand;

        StubProcessFactory(Process p) {
            this(p, null);
        }

        StubProcessFactory(Process p, byte[] audio) {
            this.p = p;
            this.audio = audio;
        }

        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            lastCommand = List.copyOf(command);
            if (audio != null) {
                int idx = command.indexOf("--out_path");
                Files.write(Path.of(command.get(idx + 1)), audio);
            }
            return p;
        }

        List<String> lastCommand() {
            return lastCommand;
        }
    }

    /** Factory whose process never starts. */
    static final class FailingProcessFactory implements ProcessFactory {
        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            throw new IOException("No such file or directory");
        }
    }

    /**
     * Minimal fake Process that allows controlling stdout/stderr, exit code, and termination timing.
     */
    static final class TestProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private final long finishAfterMillis;
        private volatile boolean alive = true;
        private volatile boolean destroyCalled = false;

        TestProcess(ProcessBehavior behavior) {
            this.out = behavior.stdout().getBytes(StandardCharsets.UTF_8);
            this.err = behavior.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = behavior.exitCode();
            this.finishAfterMillis = behavior.finishAfterMillis();
            if (finishAfterMillis == 0) {
                this.alive = false;
            }
        }

        boolean wasDestroyCalled() {
            return destroyCalled;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() {
            this.alive = false;
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            long ms = unit.toMillis(timeout);
            if (!alive) {
                return true;
            }
            if (finishAfterMillis < 0) {
                Thread.sleep(ms);
                return false;
            }
            if (finishAfterMillis <= ms) {
                Thread.sleep(finishAfterMillis);
                this.alive = false;
                return true;
            }
            Thread.sleep(ms);
            return false;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            alive = false;
        }

        @Override
        public Process destroyForcibly() {
            destroyCalled = true;
            alive = false;
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
