package com.growpad.core.repo;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration for preparing target working trees.
 */
@Component
@ConfigurationProperties(prefix = "growpad.repository")
public class RepositoryProperties {

    /** Directory holding baselines addressed as {@code local://<name>}. */
    private String localRoot = "./data/baselines";

    /** Longest a run waits for another run on the same workspace to release the tree. */
    private Duration lockTimeout = Duration.ofMinutes(10);

    private Duration cloneTimeout = Duration.ofSeconds(120);

    public String getLocalRoot() { return localRoot; }
    public void setLocalRoot(String localRoot) { this.localRoot = localRoot; }

    public Duration getLockTimeout() { return lockTimeout; }
    public void setLockTimeout(Duration lockTimeout) { this.lockTimeout = lockTimeout; }

    public Duration getCloneTimeout() { return cloneTimeout; }
    public void setCloneTimeout(Duration cloneTimeout) { this.cloneTimeout = cloneTimeout; }
}
