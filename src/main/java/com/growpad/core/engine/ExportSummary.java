package com.growpad.core.engine;

import com.growpad.core.model.EvidenceMap;
import com.growpad.core.model.Run;
import com.growpad.core.model.TicketPlan;
import com.growpad.core.verify.VerificationResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scorecard written as {@code run-summary.json}.
 */
public record ExportSummary(
    String passFail,
    int retriesUsed,
    List<String> filesChanged,
    double confidenceScore,
    int totalTickets,
    double totalEstimateHours,
    int testsPassed,
    int testsFailed,
    int testsSkipped,
    String duration
) {

    static final double DEFAULT_CONFIDENCE = 0.7;

    private static final Pattern PASSED = Pattern.compile("(\\d+) passed");
    private static final Pattern FAILED = Pattern.compile("(\\d+) (?:failed|error)");
    private static final Pattern SKIPPED = Pattern.compile("(\\d+) skipped");

    /**
     * @param verification last verification result; null if the run never got that far
     * @param plan         ticket plan; null if tickets were never generated
     * @param evidenceMap  evidence map; null if synthesis never completed
     */
    public static ExportSummary of(Run run, VerificationResult verification, TicketPlan plan,
                                   EvidenceMap evidenceMap, Collection<String> filesChanged, Instant now) {
        boolean passed = verification != null && verification.passed();
        String output = verification == null ? "" : verification.stdout();
        int testsPassed = count(PASSED, output, passed ? 1 : 0);
        int testsFailed = count(FAILED, output, passed ? 0 : 1);
        int testsSkipped = count(SKIPPED, output, 0);

        Instant created = run.getTimestamps().get(Run.CREATED_AT);
        String duration = created == null ? "--" : Duration.between(created, now).toSeconds() + "s";

        return new ExportSummary(
                passed ? "pass" : "fail",
                run.getRetryCount(),
                List.copyOf(new TreeSet<>(filesChanged)),
                evidenceMap == null ? DEFAULT_CONFIDENCE : evidenceMap.meanConfidence(DEFAULT_CONFIDENCE),
                plan == null ? 0 : plan.tickets().size(),
                plan == null ? 0 : plan.totalEstimateHours(),
                testsPassed,
                testsFailed,
                testsSkipped,
                duration);
    }

    private static int count(Pattern pattern, String output, int fallback) {
        Matcher m = pattern.matcher(output);
        int total = 0;
        boolean found = false;
        while (m.find()) {
            total += Integer.parseInt(m.group(1));
            found = true;
        }
        return found ? total : fallback;
    }
}
