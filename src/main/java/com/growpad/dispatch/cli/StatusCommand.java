package com.growpad.dispatch.cli;

import com.growpad.core.engine.RunOrchestrator;
import com.growpad.core.store.RunNotFoundException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: growpad status &lt;run-id&gt;
 * <p>
 * Reads the persisted state of a run and prints its summary.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check run status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    private final RunOrchestrator orchestrator;

    public StatusCommand(RunOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            ConsoleOutput.summary(orchestrator.status(runId));
        } catch (RunNotFoundException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }
}
