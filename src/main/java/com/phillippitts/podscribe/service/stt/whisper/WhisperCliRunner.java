package com.phillippitts.podscribe.service.stt.whisper;

import com.phillippitts.podscribe.exception.TranscriptionException;
import com.phillippitts.podscribe.exception.TranscriptionExceptionBuilder;
import com.phillippitts.podscribe.util.ProcessTimeouts;
import com.phillippitts.podscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

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
 * Runs one Whisper command line tool invocation to completion.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Start the process via {@link ProcessFactory}</li>
 *   <li>Drain stdout and stderr concurrently so the child never blocks on a full pipe</li>
 *   <li>Enforce the optional timeout and terminate runaway processes</li>
 *   <li>Translate failures into {@link TranscriptionException} with exit code, duration and stderr tail</li>
 *   <li>Idempotent {@link #close()} so a shutdown can kill an in-flight run</li>
 * </ul>
 *
 * <p>Reading the JSON result file is the caller's job; this class only deals with the process.
 */
final class WhisperCliRunner implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(WhisperCliRunner.class);

    private final ProcessFactory processFactory;
    private final String engineName;
    private final int maxStdoutBytes;

    private volatile Process current;
    private volatile Thread outGobbler;
    private volatile Thread errGobbler;

    /**
     * Output of a successful run.
     *
     * @param stdout     captured stdout (verbose segment lines when enabled)
     * @param stderr     captured stderr
     * @param durationMs wall time of the run
     */
    record CliResult(String stdout, String stderr, long durationMs) {}

    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    private record ErrorContext(
            List<String> command,
            int exitCode,
            StringBuilder stderr,
            long startNano,
            Throwable cause
    ) {}

    WhisperCliRunner(ProcessFactory processFactory, String engineName, int maxStdoutBytes) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.engineName = Objects.requireNonNull(engineName, "engineName");
        this.maxStdoutBytes = maxStdoutBytes;
    }

    /**
     * Runs the command and waits for it to exit.
     *
     * @param command    full command line
     * @param workingDir working directory (may be null)
     * @param timeout    maximum run time; null or zero waits indefinitely
     * @return captured output of a zero-exit run
     * @throws TranscriptionException on timeout, non-zero exit, start failure or interruption
     */
    CliResult run(List<String> command, Path workingDir, Duration timeout) {
        Objects.requireNonNull(command, "command");
        long startTime = System.nanoTime();
        LOG.debug("Starting {}: {}", engineName, String.join(" ", command));

        try {
            ProcessExecution exec = startProcessWithGobblers(command, workingDir);
            this.outGobbler = exec.outGobbler();
            this.errGobbler = exec.errGobbler();

            waitForProcessCompletion(exec, command, timeout, startTime);
            return handleProcessResult(exec, command, startTime);
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            ErrorContext ctx = new ErrorContext(command, -1, null, startTime, e);
            throw cliError("I/O failure: " + e.getMessage(), ctx);
        } finally {
            close();
        }
    }

    private ProcessExecution startProcessWithGobblers(List<String> command, Path workingDir) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        Process process = processFactory.start(command, workingDir);
        this.current = process;

        // Start gobblers before waiting to avoid deadlock on full pipes
        Thread out = startGobbler(process.getInputStream(), stdout, engineName + "-out", maxStdoutBytes);
        Thread err = startGobbler(process.getErrorStream(), stderr, engineName + "-err",
                WhisperConstants.STDERR_MAX_BYTES);
        return new ProcessExecution(process, out, err, stdout, stderr);
    }

    private void waitForProcessCompletion(ProcessExecution exec, List<String> command, Duration timeout,
                                          long startTime) throws InterruptedException {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            exec.process().waitFor();
        } else {
            boolean finished = exec.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(exec.process());
                ErrorContext ctx = new ErrorContext(command, -1, exec.stderr(), startTime, null);
                throw cliError("Timeout after " + timeout.toSeconds() + "s", ctx);
            }
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
    }

    private CliResult handleProcessResult(ProcessExecution exec, List<String> command, long startTime) {
        int exitCode = exec.process().exitValue();
        if (exitCode != 0) {
            ErrorContext ctx = new ErrorContext(command, exitCode, exec.stderr(), startTime, null);
            throw cliError("Non-zero exit: " + exitCode, ctx);
        }
        long durationMs = TimeUtils.elapsedMillis(startTime);
        LOG.debug("{} finished in {} ms (stdout={} chars, stderr={} chars)",
                engineName, durationMs, exec.stdout().length(), exec.stderr().length());
        return new CliResult(exec.stdout().toString(), exec.stderr().toString(), durationMs);
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a bounded buffer. Once the cap is hit the stream is still drained so the
     * child process never blocks, but further lines are discarded. Every line is traced at DEBUG,
     * which is how verbose segment output reaches the log.
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
                    LOG.debug("[{}] {}", name, line);
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
                        sink.append(line, 0, Math.min(line.length(), Math.max(available, 0)));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
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
                    LOG.warn("{} process still alive after destroyForcibly", engineName);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying {} process", engineName);
        } catch (RuntimeException e) {
            LOG.warn("Error destroying {} process: {}", engineName, e.toString());
        }
    }

    private TranscriptionException cliError(String msg, ErrorContext ctx) {
        long durationMs = TimeUtils.elapsedMillis(ctx.startNano());
        TranscriptionExceptionBuilder builder = TranscriptionExceptionBuilder.create(msg)
                .engine(engineName)
                .exitCode(ctx.exitCode())
                .durationMs(durationMs)
                .metadata("binary", ctx.command().isEmpty() ? null : ctx.command().get(0));
        if (ctx.stderr() != null) {
            builder.metadata("stderr", tail(ctx.stderr(), WhisperConstants.ERROR_SNIPPET_MAX_CHARS));
        }
        if (ctx.cause() != null) {
            builder.cause(ctx.cause());
        }
        return builder.build();
    }

    // The end of stderr holds the Python traceback, which is what explains the failure
    private static String tail(StringBuilder sb, int maxChars) {
        synchronized (sb) {
            int from = Math.max(0, sb.length() - maxChars);
            return sb.substring(from);
        }
    }

    /**
     * Idempotent cleanup of any running process and gobbler threads.
     */
    @Override
    public void close() {
        Process process = this.current;
        this.current = null;
        if (process != null && process.isAlive()) {
            destroyProcess(process);
        }
        joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        outGobbler = null;
        errGobbler = null;
    }
}
