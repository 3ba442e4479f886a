package io.isoflow.core.render.backend;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Runs an external command with a hard timeout.
///
/// Output goes to a temporary file instead of a pipe, so a chatty process can never
/// block on a full buffer while the runner waits for it.
///
/// ### Termination
/// - Timeout: the process is destroyed forcibly and {@link TimeoutException} is thrown
/// - Interruption of the calling thread: the process is destroyed forcibly and
///   {@link InterruptedException} is rethrown with the interrupt flag restored
///
/// @implNote Stateless and thread-safe.
public final class ProcessRunner {

    private static final Logger logger = Logger.getLogger(ProcessRunner.class.getName());

    static final int OUTPUT_CAPTURE_LIMIT = 4096;

    /// Runs a command and waits for it.
    ///
    /// @param command executable and arguments, not null, not empty
    /// @param workDir working directory, not null
    /// @param timeout upper bound on the wait, not null
    /// @return exit code and captured output, never null
    /// @throws IOException if the process cannot be started
    /// @throws TimeoutException if the process outlives `timeout`
    /// @throws InterruptedException if the calling thread is interrupted while waiting
    public ProcessResult run(List<String> command, Path workDir, Duration timeout)
            throws IOException, TimeoutException, InterruptedException {
        Path log = Files.createTempFile(workDir, "process-", ".log");
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workDir.toFile());
        pb.redirectErrorStream(true);
        pb.redirectOutput(log.toFile());

        logger.fine("Running: " + String.join(" ", command));
        try {
            return await(pb.start(), command, timeout, log);
        } finally {
            deleteLog(log);
        }
    }

    private static ProcessResult await(
            Process process, List<String> command, Duration timeout, Path log)
            throws IOException, TimeoutException, InterruptedException {
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new TimeoutException(
                        command.get(0) + " timed out after " + timeout.toMillis() + "ms");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw e;
        }

        return new ProcessResult(process.exitValue(), readCapped(log));
    }

    private static void deleteLog(Path log) {
        try {
            Files.deleteIfExists(log);
        } catch (IOException e) {
            logger.fine("Could not delete " + log + ": " + e.getMessage());
        }
    }

    private static String readCapped(Path log) throws IOException {
        byte[] bytes = Files.readAllBytes(log);
        int length = Math.min(bytes.length, OUTPUT_CAPTURE_LIMIT);
        return new String(bytes, 0, length, StandardCharsets.UTF_8).strip();
    }
}
