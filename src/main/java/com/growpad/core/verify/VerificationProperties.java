package com.growpad.core.verify;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the verification step.
 */
@Component
@ConfigurationProperties(prefix = "growpad.verification")
public class VerificationProperties {

    private String defaultCommand = "pytest";

    /** Exact commands, or prefixes when the entry ends in {@code *}. */
    private List<String> allowedCommands = new ArrayList<>(List.of("pytest", "pytest *"));

    private Duration timeout = Duration.ofSeconds(120);

    private String pythonExecutable = "python3";

    private String testGlob = "tests/**/test_*.py";

    public String getDefaultCommand() { return defaultCommand; }
    public void setDefaultCommand(String defaultCommand) { this.defaultCommand = defaultCommand; }

    public List<String> getAllowedCommands() { return allowedCommands; }
    public void setAllowedCommands(List<String> allowedCommands) { this.allowedCommands = allowedCommands; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    public String getPythonExecutable() { return pythonExecutable; }
    public void setPythonExecutable(String pythonExecutable) { this.pythonExecutable = pythonExecutable; }

    public String getTestGlob() { return testGlob; }
    public void setTestGlob(String testGlob) { this.testGlob = testGlob; }
}
