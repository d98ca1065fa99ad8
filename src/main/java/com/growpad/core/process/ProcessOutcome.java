package com.growpad.core.process;

/**
 * Captured result of an external command.
 */
public record ProcessOutcome(
    int exitCode,
    String stdout,
    String stderr,
    long durationMs,
    boolean timedOut
) {

    public boolean succeeded() {
        return exitCode == 0 && !timedOut;
    }
}
