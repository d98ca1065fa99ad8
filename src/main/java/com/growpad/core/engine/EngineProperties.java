package com.growpad.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Timing and defaults for run execution.
 */
@Component
@ConfigurationProperties(prefix = "growpad.engine")
public class EngineProperties {

    /** Evidence used when a run request names none. */
    private String sampleEvidenceDir = "./data/sample_evidence";

    /** Longest a gated wait sleeps before re-reading state. */
    private Duration gatePollInterval = Duration.ofMillis(500);

    private Duration featureSelectionTimeout = Duration.ofSeconds(300);

    private Duration approvalTimeout = Duration.ofSeconds(300);

    /** How long a finished run's registry entry and event queue outlive it. */
    private Duration registryGracePeriod = Duration.ofMinutes(10);

    public String getSampleEvidenceDir() { return sampleEvidenceDir; }
    public void setSampleEvidenceDir(String sampleEvidenceDir) { this.sampleEvidenceDir = sampleEvidenceDir; }

    public Duration getGatePollInterval() { return gatePollInterval; }
    public void setGatePollInterval(Duration gatePollInterval) { this.gatePollInterval = gatePollInterval; }

    public Duration getFeatureSelectionTimeout() { return featureSelectionTimeout; }
    public void setFeatureSelectionTimeout(Duration featureSelectionTimeout) { this.featureSelectionTimeout = featureSelectionTimeout; }

    public Duration getApprovalTimeout() { return approvalTimeout; }
    public void setApprovalTimeout(Duration approvalTimeout) { this.approvalTimeout = approvalTimeout; }

    public Duration getRegistryGracePeriod() { return registryGracePeriod; }
    public void setRegistryGracePeriod(Duration registryGracePeriod) { this.registryGracePeriod = registryGracePeriod; }
}
