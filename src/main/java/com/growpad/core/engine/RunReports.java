package com.growpad.core.engine;

import com.growpad.core.model.FailureCause;
import com.growpad.core.model.StageId;
import com.growpad.core.verify.VerificationResult;

/**
 * Markdown reports written into a run's artifacts.
 */
final class RunReports {

    static final String TEST_REPORT = "test-report.md";
    static final String FAILURE_REPORT = "failure-report.md";

    private RunReports() {}

    static String testReport(String command, VerificationResult result) {
        return """
                # Test Report

                - Command: %s
                - Summary: %s
                - Exit Code: %d
                - Duration (ms): %d

                ## stdout
                ```
                %s
                ```

                ## stderr
                ```
                %s
                ```
                """.formatted(command, result.summary(), result.exitCode(), result.durationMs(),
                nullToEmpty(result.stdout()).strip(), nullToEmpty(result.stderr()).strip());
    }

    static String failureReport(StageId stage, FailureCause cause, String error, int retriesUsed) {
        return """
                # Failure Report

                - Stage: %s
                - Cause: %s
                - Error: %s
                - Retries Used: %d
                """.formatted(stage == null ? "NONE" : stage.name(), cause, error, retriesUsed);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
