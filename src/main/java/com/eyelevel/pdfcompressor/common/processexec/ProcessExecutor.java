package com.eyelevel.pdfcompressor.common.processexec;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

@Component
@Slf4j
public class ProcessExecutor {

    /**
     * Upper bound on captured stdout/stderr. Enough for Ghostscript diagnostics without risking memory.
     */
    private static final int MAX_CAPTURE_BYTES = 16 * 1024;

    private static final long DRAIN_GRACE_SECONDS = 5;

    /**
     * Executes a command-line process with a timeout and memory-safe stream handling.
     *
     * @param command        The command and its arguments to execute.
     * @param contextInfo    A string for logging context, usually the job id.
     * @param timeoutMinutes The maximum time to wait for the process to complete.
     * @param processName    A descriptive name for the process (e.g., "Ghostscript").
     * @return A ProcessResult containing the exit code and a truncated portion of stdout and stderr.
     * @throws ProcessLaunchException  if the executable could not be started.
     * @throws ProcessTimeoutException if the process exceeded the timeout and was killed.
     * @throws IOException             if any other I/O error occurs.
     * @throws InterruptedException    if the waiting thread is interrupted.
     */
    public ProcessResult execute(List<String> command, String contextInfo, long timeoutMinutes, String processName)
    throws IOException, InterruptedException {

        final Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new ProcessLaunchException(processName + " could not be started: " + e.getMessage(), e);
        }

        StringBuilder stdoutCapture = new StringBuilder();
        StringBuilder stderrCapture = new StringBuilder();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> stdout = executor.submit(new StreamConsumer(process.getInputStream(), stdoutCapture::append, null));
            Future<?> stderr = executor.submit(new StreamConsumer(process.getErrorStream(), stderrCapture::append,
                                                                  line -> log.warn("[{}] [{}-stderr] {}", contextInfo, processName, line)));

            if (!process.waitFor(timeoutMinutes, TimeUnit.MINUTES)) {
                process.destroyForcibly();
                throw new ProcessTimeoutException(processName + " process timed out after " + timeoutMinutes + " minutes.");
            }
            awaitDrain(stdout, contextInfo);
            awaitDrain(stderr, contextInfo);
        } finally {
            executor.shutdownNow();
        }

        return new ProcessResult(process.exitValue(), stdoutCapture.toString().trim(), stderrCapture.toString().trim());
    }

    private void awaitDrain(Future<?> consumer, String contextInfo) throws InterruptedException {
        try {
            consumer.get(DRAIN_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[{}] Process output could not be fully captured: {}", contextInfo, e.toString());
        }
    }

    /**
     * Consumes an InputStream, captures its content up to a limit, and optionally logs each line.
     * This prevents both pipe deadlocks and OutOfMemoryErrors.
     */
    private static class StreamConsumer implements Runnable {
        private final InputStream inputStream;
        private final Consumer<String> captureConsumer;
        private final Consumer<String> lineLogger;
        private int bytesCaptured = 0;

        StreamConsumer(InputStream inputStream, Consumer<String> captureConsumer, Consumer<String> lineLogger) {
            this.inputStream = inputStream;
            this.captureConsumer = captureConsumer;
            this.lineLogger = lineLogger;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (lineLogger != null) {
                        lineLogger.accept(line);
                    }
                    if (bytesCaptured < MAX_CAPTURE_BYTES) {
                        String lineWithNewline = line + "\n";
                        captureConsumer.accept(lineWithNewline);
                        bytesCaptured += lineWithNewline.getBytes(StandardCharsets.UTF_8).length;
                    }
                }
            } catch (IOException e) {
                log.error("Error reading process stream.", e);
            }
        }
    }

    /**
     * The result of an external process execution.
     *
     * @param exitCode The exit code of the process. 0 means success.
     * @param stdout   The captured standard output (truncated to a safe limit).
     * @param stderr   The captured standard error output (truncated to a safe limit).
     */
    public record ProcessResult(int exitCode, String stdout, String stderr) {
    }
}
