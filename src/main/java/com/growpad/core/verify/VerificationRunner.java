package com.growpad.core.verify;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Runs the target repository's checks.
 */
public interface VerificationRunner {

    /**
     * @param targetDir working tree to verify
     * @param command   allow-listed check command
     * @param timeout   hard limit; exceeding it yields exit code 124, not an exception
     */
    VerificationResult run(Path targetDir, String command, Duration timeout);
}
