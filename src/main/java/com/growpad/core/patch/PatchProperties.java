package com.growpad.core.patch;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for patch sanitizing and application.
 */
@Component
@ConfigurationProperties(prefix = "growpad.patch")
public class PatchProperties {

    /** File types whose diff sections are dropped before applying. */
    private List<String> binaryExtensions = new ArrayList<>(List.of(
            ".png", ".jpg", ".jpeg", ".gif", ".ico", ".webp", ".pdf", ".woff", ".woff2", ".ttf", ".eot"));

    /** Strategy names in the order they are tried. */
    private List<String> strategies = new ArrayList<>(List.of(GitApplyStrategy.NAME, GnuPatchStrategy.NAME));

    private Duration timeout = Duration.ofSeconds(60);

    public List<String> getBinaryExtensions() { return binaryExtensions; }
    public void setBinaryExtensions(List<String> binaryExtensions) { this.binaryExtensions = binaryExtensions; }

    public List<String> getStrategies() { return strategies; }
    public void setStrategies(List<String> strategies) { this.strategies = strategies; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
}
