package com.phillippitts.mathscrap.service.ocr.process;

import com.phillippitts.mathscrap.config.ocr.ProcessBackendConfig;
import com.phillippitts.mathscrap.domain.FailureKind;
import com.phillippitts.mathscrap.exception.RecognitionException;
import com.phillippitts.mathscrap.exception.RecognitionExceptionBuilder;
import com.phillippitts.mathscrap.util.ProcessTimeouts;
import com.phillippitts.mathscrap.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one external recognizer invocation and returns its stdout.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}
 * - Capture stdout (result) and stderr (diagnostics) concurrently, each with a byte cap
 * - Enforce the configured timeout and terminate runaway processes
 * - Report failures as {@link RecognitionException} with the matching {@link FailureKind}
 *
 * <p>The runner holds no per-call state, so concurrent invocations from different backends
 * are independent. Temp-file handling is performed by the caller.
 */
@Component
public class OcrProcessRunner {

    private static final Logger LOG = LogManager.getLogger(OcrProcessRunner.class);

    static final int STDERR_MAX_BYTES = 16 * 1024;
    static final int ERROR_SNIPPET_MAX_CHARS = 400;

    private final ProcessFactory processFactory;

    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    /**
     * Context for building failure messages.
     */
    private record ErrorContext(
            ProcessBackendConfig cfg,
            int exitCode,
            StringBuilder stderr,
            long startNano,
            Throwable cause
    ) {}

    public OcrProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Executes a command and returns its stdout.
     *
     * @param command     executable followed by its arguments
     * @param workingDir  working directory (may be null)
     * @param cfg         timeout and output cap
     * @param backendName name reported in failures
     * @return stdout, possibly empty
     * @throws RecognitionException {@link FailureKind#UNAVAILABLE} when the process cannot start,
     *                              {@link FailureKind#TIMEOUT} when it exceeds the timeout,
     *                              {@link FailureKind#RUNTIME_ERROR} on a non-zero exit or interrupt
     */
    public String run(List<String> command, Path workingDir, ProcessBackendConfig cfg, String backendName) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(cfg, "cfg");
        long startTime = System.nanoTime();

        ProcessExecution exec;
        try {
            exec = start(command, workingDir, cfg, backendName);
        } catch (IOException e) {
            throw error("Failed to start process: " + e.getMessage(), backendName, FailureKind.UNAVAILABLE,
                    new ErrorContext(cfg, -1, null, startTime, e));
        }

        try {
            boolean finished = exec.process().waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                destroyProcess(exec.process());
                throw error("Timeout after " + cfg.timeoutSeconds() + "s", backendName, FailureKind.TIMEOUT,
                        new ErrorContext(cfg, -1, exec.stderr(), startTime, null));
            }
            joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            if (exitCode != 0) {
                throw error("Non-zero exit: " + exitCode, backendName, FailureKind.RUNTIME_ERROR,
                        new ErrorContext(cfg, exitCode, exec.stderr(), startTime, null));
            }
            String output = exec.stdout().toString();
            LOG.debug("{} stdout size={} chars in {} ms", backendName, output.length(),
                    TimeUtils.elapsedMillis(startTime));
            return output;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyProcess(exec.process());
            throw error("Interrupted while waiting for process", backendName, FailureKind.RUNTIME_ERROR,
                    new ErrorContext(cfg, -1, exec.stderr(), startTime, e));
        } finally {
            if (exec.process().isAlive()) {
                destroyProcess(exec.process());
            }
            joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        }
    }

    private ProcessExecution start(List<String> command, Path workingDir, ProcessBackendConfig cfg,
                                   String backendName) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = processFactory.start(command, workingDir);
        // Gobblers start before waitFor so a full pipe never blocks the child
        Thread out = startGobbler(process.getInputStream(), stdout, backendName + "-out", cfg.maxStdoutBytes());
        Thread err = startGobbler(process.getErrorStream(), stderr, backendName + "-err", STDERR_MAX_BYTES);
        return new ProcessExecution(process, out, err, stdout, stderr);
    }

    private static Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a sink until the cap is reached, then keeps draining without accumulating.
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
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
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
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }

    private static RecognitionException error(String msg, String backendName, FailureKind kind, ErrorContext ctx) {
        String stderrSnippet = "";
        if (ctx.stderr() != null) {
            synchronized (ctx.stderr()) {
                stderrSnippet = ctx.stderr().substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, ctx.stderr().length()));
            }
        }
        RecognitionExceptionBuilder builder = RecognitionExceptionBuilder.create(msg)
                .backend(backendName)
                .kind(kind)
                .exitCode(ctx.exitCode())
                .durationMs(TimeUtils.elapsedMillis(ctx.startNano()))
                .metadata("binaryPath", ctx.cfg().binaryPath())
                .metadata("stderr", stderrSnippet.isEmpty() ? null : stderrSnippet);
        if (ctx.cause() != null) {
            builder.cause(ctx.cause());
        }
        return builder.build();
    }
}
