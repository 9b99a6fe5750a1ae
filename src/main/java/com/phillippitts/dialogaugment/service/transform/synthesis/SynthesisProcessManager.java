package com.phillippitts.dialogaugment.service.transform.synthesis;

import com.phillippitts.dialogaugment.config.transform.SynthesisConfig;
import com.phillippitts.dialogaugment.exception.TransformException;
import com.phillippitts.dialogaugment.exception.TransformExceptionBuilder;
import com.phillippitts.dialogaugment.util.ProcessTimeouts;
import com.phillippitts.dialogaugment.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external text-to-speech command line tool for one utterance.
 *
 * <p>Responsibilities:
 * - Build the CLI from {@link SynthesisConfig}
 * - Start the process via {@link ProcessFactory}
 * - Capture stdout and stderr concurrently so the process never blocks on a full pipe
 * - Enforce the timeout and terminate runaway processes
 * - Verify that the output file was produced
 * - Provide structured error context through {@link TransformExceptionBuilder}
 *
 * <p>Each call owns its process, so concurrent calls from several workers are safe.
 * {@link #close()} terminates whatever is still running.
 */
@Component
@ConditionalOnProperty(name = "augment.transform.type", havingValue = "synthesis", matchIfMissing = true)
public class SynthesisProcessManager implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(SynthesisProcessManager.class);

    static final String TRANSFORM = "synthesis";
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    private final ProcessFactory processFactory;
    private final Set<Process> running = ConcurrentHashMap.newKeySet();

    /**
     * Holds process execution state including process reference and stream gobblers.
     */
    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    /**
     * Context for creating detailed error messages.
     */
    private record ErrorContext(
            SynthesisConfig cfg,
            int exitCode,
            StringBuilder stderr,
            long startNano,
            Throwable cause
    ) {}

    @Autowired
    public SynthesisProcessManager() {
        this(new DefaultProcessFactory());
    }

    SynthesisProcessManager(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Synthesizes {@code text} into {@code outputFile}.
     *
     * <p>CLI contract:
     * <pre>
     * ${binary} --text ${text} --model_name ${model} --out_path ${outputFile} [--use_cuda true]
     * </pre>
     *
     * @param text       utterance to speak
     * @param outputFile where the tool must write the waveform
     * @param binary     resolved executable
     * @param cfg        synthesis configuration
     * @throws TransformException (transient) on timeout, I/O error, non-zero exit or missing output
     */
    public void synthesize(String text, Path outputFile, Path binary, SynthesisConfig cfg) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(outputFile, "outputFile");
        Objects.requireNonNull(binary, "binary");
        Objects.requireNonNull(cfg, "cfg");

        List<String> command = buildCommand(text, outputFile, binary, cfg);
        long startTime = System.nanoTime();
        ProcessExecution exec = null;
        try {
            exec = startProcessWithGobblers(command, outputFile.getParent(), cfg);
            waitForProcessCompletion(exec, cfg, startTime);
            handleProcessResult(exec, outputFile, cfg, startTime);
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            ErrorContext ctx = new ErrorContext(cfg, -1, exec == null ? null : exec.stderr(), startTime, e);
            throw synthesisError("I/O failure: " + e.getMessage(), ctx);
        } finally {
            if (exec != null) {
                cleanup(exec);
            }
        }
    }

    List<String> buildCommand(String text, Path outputFile, Path binary, SynthesisConfig cfg) {
        List<String> cmd = new ArrayList<>();
        cmd.add(binary.toString());
        cmd.add("--text");
        cmd.add(text);
        cmd.add("--model_name");
        cmd.add(cfg.modelName());
        cmd.add("--out_path");
        cmd.add(outputFile.toAbsolutePath().toString());
        if (cfg.useCuda()) {
            cmd.add("--use_cuda");
            cmd.add("true");
        }
        return cmd;
    }

    private ProcessExecution startProcessWithGobblers(List<String> command, Path workingDir, SynthesisConfig cfg)
            throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        Process process = processFactory.start(command, workingDir);
        running.add(process);

        // Start gobblers before waiting to avoid deadlock
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, "tts-out", cfg.maxOutputBytes());
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, "tts-err", cfg.maxOutputBytes());

        return new ProcessExecution(process, outGobbler, errGobbler, stdout, stderr);
    }

    private void waitForProcessCompletion(ProcessExecution exec, SynthesisConfig cfg, long startTime)
            throws InterruptedException {
        boolean finished = exec.process().waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS);
        if (!finished) {
            destroyProcess(exec.process());
            ErrorContext ctx = new ErrorContext(cfg, -1, exec.stderr(), startTime, null);
            throw synthesisError("Timeout after " + cfg.timeoutSeconds() + "s", ctx);
        }

        // Let gobblers flush what the process wrote before exiting
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
    }

    private void handleProcessResult(ProcessExecution exec, Path outputFile, SynthesisConfig cfg,
                                     long startTime) throws IOException {
        int exitCode = exec.process().exitValue();
        if (exitCode != 0) {
            ErrorContext ctx = new ErrorContext(cfg, exitCode, exec.stderr(), startTime, null);
            throw synthesisError("Non-zero exit: " + exitCode, ctx);
        }
        if (!Files.isRegularFile(outputFile) || Files.size(outputFile) == 0) {
            ErrorContext ctx = new ErrorContext(cfg, exitCode, exec.stderr(), startTime, null);
            throw synthesisError("No audio written to " + outputFile.getFileName(), ctx);
        }
        LOG.debug("Synthesis finished in {} ms (bytes={}, stdout={} chars)",
                TimeUtils.elapsedMillis(startTime), Files.size(outputFile), exec.stdout().length());
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        StreamGobbler gobbler = new StreamGobbler(inputStream, sink, name, maxBytes);
        Thread thread = new Thread(gobbler, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines from a process stream into a buffer until the cap is reached, then keeps
     * draining without accumulating so the process never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
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
                                LOG.debug("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        if (line.length() > available) {
                            sink.append(line, 0, Math.max(available, 0));
                            capReached = true;
                        } else {
                            sink.append(line);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void cleanup(ProcessExecution exec) {
        running.remove(exec.process());
        if (exec.process().isAlive()) {
            destroyProcess(exec.process());
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
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
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }

    private TransformException synthesisError(String msg, ErrorContext ctx) {
        long durationMs = TimeUtils.elapsedMillis(ctx.startNano());
        String stderrSnippet;
        if (ctx.stderr() == null) {
            stderrSnippet = "";
        } else {
            synchronized (ctx.stderr()) {
                stderrSnippet = ctx.stderr().substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, ctx.stderr().length()));
            }
        }

        TransformExceptionBuilder builder = TransformExceptionBuilder.create(msg)
                .transform(TRANSFORM)
                .exitCode(ctx.exitCode())
                .durationMs(durationMs)
                .metadata("binaryPath", ctx.cfg().binaryPath())
                .metadata("model", ctx.cfg().modelName())
                .metadata("stderr", stderrSnippet);

        if (ctx.cause() != null) {
            builder.cause(ctx.cause());
        }
        return builder.build();
    }

    /** Number of synthesis processes currently alive. */
    int runningCount() {
        return running.size();
    }

    /**
     * Terminates any running synthesis processes. Idempotent.
     */
    @Override
    public void close() {
        for (Process process : List.copyOf(running)) {
            if (process.isAlive()) {
                destroyProcess(process);
            }
            running.remove(process);
        }
    }
}
