package com.growpad.dispatch.cli;

import com.growpad.core.engine.RunOrchestrator;
import com.growpad.core.model.RunRequest;
import com.growpad.core.model.RunStatus;
import com.growpad.core.model.RunSummary;
import com.growpad.core.store.WorkspaceNotFoundException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: growpad run &lt;workspace-id&gt;
 * <p>
 * Starts a run in fast mode. With {@code --wait} the command blocks until the run is
 * terminal and exits non-zero unless it completed.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Start a run")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workspace ID")
    private String workspaceId;

    @Option(names = "--evidence-dir", description = "Evidence directory (default: configured sample evidence)")
    private String evidenceDir;

    @Option(names = "--goal", description = "Product goal statement")
    private String goal;

    @Option(names = "--feature", description = "Pre-selected feature index, 0..2")
    private Integer feature;

    @Option(names = "--wait", description = "Block until the run finishes")
    private boolean waitForCompletion;

    @Option(names = "--timeout", defaultValue = "PT1H", description = "Longest --wait blocks, ISO-8601 (default: ${DEFAULT-VALUE})")
    private Duration timeout;

    private final RunOrchestrator orchestrator;

    public RunCommand(RunOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() throws Exception {
        ConsoleOutput.printBanner();
        RunSummary summary;
        try {
            summary = orchestrator.start(new RunRequest(workspaceId, evidenceDir, goal, true, feature));
        } catch (WorkspaceNotFoundException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        ConsoleOutput.info("Started run " + summary.runId());
        if (!waitForCompletion) {
            return 0;
        }

        ConsoleOutput.info("Waiting for completion...");
        try {
            summary = orchestrator.awaitCompletion(summary.runId(), timeout);
        } catch (TimeoutException e) {
            ConsoleOutput.error("Run " + summary.runId() + " still executing after " + timeout);
            return 1;
        }
        ConsoleOutput.summary(summary);
        return summary.status() == RunStatus.COMPLETED ? 0 : 1;
    }
}
