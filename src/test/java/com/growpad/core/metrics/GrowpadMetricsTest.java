package com.growpad.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GrowpadMetricsTest {

    private SimpleMeterRegistry registry;
    private GrowpadMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new GrowpadMetrics(registry);
    }

    @Test
    @DisplayName("recordRunResult counts by status tag")
    void recordRunResult() {
        metrics.recordRunResult("COMPLETED");
        metrics.recordRunResult("COMPLETED");
        metrics.recordRunResult("FAILED");

        var completed = registry.find("growpad.runs.total").tag("status", "COMPLETED").counter();
        var failed = registry.find("growpad.runs.total").tag("status", "FAILED").counter();

        assertNotNull(completed);
        assertNotNull(failed);
        assertEquals(2.0, completed.count());
        assertEquals(1.0, failed.count());
    }

    @Test
    @DisplayName("recordStageDuration records a timer per stage")
    void recordStageDuration() {
        metrics.recordStageDuration("VERIFY", 300);
        metrics.recordStageDuration("IMPLEMENT", 100);

        var verify = registry.find("growpad.stage.duration").tag("stage", "VERIFY").timer();
        assertNotNull(verify);
        assertEquals(1, verify.count());
    }

    @Test
    @DisplayName("recordPatchApplication tags strategy and outcome")
    void recordPatchApplication() {
        metrics.recordPatchApplication("git-apply", "applied");
        metrics.recordPatchApplication("none", "CONFLICT");

        var applied = registry.find("growpad.patch.applications")
                .tag("strategy", "git-apply").tag("outcome", "applied").counter();
        assertNotNull(applied);
        assertEquals(1.0, applied.count());
    }

    @Test
    @DisplayName("recordVerification counts by summary and times the run")
    void recordVerification() {
        metrics.recordVerification("PASS", 1200);
        metrics.recordVerification("FAIL", 800);

        assertEquals(1.0, registry.find("growpad.verification.runs").tag("summary", "PASS").counter().count());
        assertEquals(2, registry.find("growpad.verification.duration").timer().count());
    }

    @Test
    @DisplayName("Self-heal attempts and retries used are recorded")
    void selfHeal() {
        metrics.recordSelfHealAttempt();
        metrics.recordSelfHealAttempt();
        metrics.recordRetriesUsed(2);

        assertEquals(2.0, registry.find("growpad.self_heal.attempts").counter().count());
        var retries = registry.find("growpad.run.retries").summary();
        assertNotNull(retries);
        assertEquals(2.0, retries.totalAmount());
    }
}
