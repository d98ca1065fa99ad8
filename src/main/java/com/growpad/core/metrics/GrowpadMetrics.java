package com.growpad.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for run execution.
 */
@Service
public class GrowpadMetrics {

    private final MeterRegistry registry;

    public GrowpadMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunResult(String status) {
        Counter.builder("growpad.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordStageDuration(String stage, long ms) {
        Timer.builder("growpad.stage.duration")
                .tag("stage", stage)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSelfHealAttempt() {
        Counter.builder("growpad.self_heal.attempts")
                .description("Corrective patch attempts after a failed verification")
                .register(registry)
                .increment();
    }

    /**
     * @param strategy name of the strategy that applied the patch, or {@code none}
     * @param outcome  {@code applied} or the failure kind
     */
    public void recordPatchApplication(String strategy, String outcome) {
        Counter.builder("growpad.patch.applications")
                .tag("strategy", strategy)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordVerification(String summary, long ms) {
        Counter.builder("growpad.verification.runs")
                .tag("summary", summary)
                .register(registry)
                .increment();
        Timer.builder("growpad.verification.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRetriesUsed(int retries) {
        DistributionSummary.builder("growpad.run.retries")
                .description("Self-heal retries used per finished run")
                .register(registry)
                .record(retries);
    }
}
