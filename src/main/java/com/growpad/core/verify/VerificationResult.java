package com.growpad.core.verify;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of a verification run. A non-zero exit code is a verification failure,
 * not an error.
 *
 * @param summary {@code PASS}, {@code FAIL}, {@code TIMEOUT} or {@code DENIED}
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record VerificationResult(
    String stdout,
    String stderr,
    int exitCode,
    long durationMs,
    String summary
) {

    public static final String PASS = "PASS";
    public static final String FAIL = "FAIL";
    public static final String TIMEOUT = "TIMEOUT";
    public static final String DENIED = "DENIED";

    public boolean passed() {
        return exitCode == 0;
    }
}
