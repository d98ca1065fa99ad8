package com.growpad.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs external tools ({@code git}, {@code patch}, {@code python}) with a hard timeout.
 * <p>
 * Output goes to temp files rather than pipes so a chatty process can never block on a
 * full buffer. A process still running at the deadline is killed and reported with
 * exit code {@value #TIMEOUT_EXIT_CODE}.
 */
@Component
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    public static final int TIMEOUT_EXIT_CODE = 124;

    public ProcessOutcome run(Path workDir, Duration timeout, List<String> command) {
        return run(workDir, timeout, Map.of(), command);
    }

    /**
     * @throws ProcessExecutionException if the process cannot be started or the wait is interrupted
     */
    public ProcessOutcome run(Path workDir, Duration timeout, Map<String, String> environment, List<String> command) {
        log.debug("Running: {} (in {})", String.join(" ", command), workDir);
        Path stdoutFile = null;
        Path stderrFile = null;
        long start = System.currentTimeMillis();
        try {
            stdoutFile = Files.createTempFile("growpad-proc-", ".out");
            stderrFile = Files.createTempFile("growpad-proc-", ".err");
            ProcessBuilder builder = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            builder.environment().putAll(environment);
            Process process = builder.start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
            }
            long duration = System.currentTimeMillis() - start;
            String stdout = Files.readString(stdoutFile, StandardCharsets.UTF_8);
            String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8);
            if (!finished) {
                log.warn("Command timed out after {}ms: {}", timeout.toMillis(), command.get(0));
                return new ProcessOutcome(TIMEOUT_EXIT_CODE, stdout, stderr + "\nCommand timed out", duration, true);
            }
            int exitCode = process.exitValue();
            log.debug("{} exited with {} in {}ms", command.get(0), exitCode, duration);
            return new ProcessOutcome(exitCode, stdout, stderr, duration, false);
        } catch (IOException e) {
            throw new ProcessExecutionException("Failed to run " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessExecutionException("Interrupted while running " + command.get(0), e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }
}
