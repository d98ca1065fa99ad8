package com.growpad.dispatch.cli;

import com.growpad.core.model.Guardrails;
import com.growpad.core.model.Workspace;
import com.growpad.core.model.WorkspaceMode;
import com.growpad.core.store.WorkspaceStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command group: growpad workspace ...
 */
@Command(name = "workspace", mixinStandardHelpOptions = true, description = "Manage workspaces",
        subcommands = {WorkspaceCommand.Create.class})
@Component
public class WorkspaceCommand implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    /**
     * growpad workspace create --team &lt;name&gt; --repo &lt;url&gt;
     */
    @Command(name = "create", mixinStandardHelpOptions = true, description = "Create a workspace")
    @Component
    public static class Create implements Runnable {

        @Option(names = "--team", required = true, description = "Owning team")
        private String team;

        @Option(names = "--repo", required = true, description = "Repository URL, or local://<name> for a baseline")
        private String repo;

        @Option(names = "--branch", defaultValue = "main", description = "Branch (default: ${DEFAULT-VALUE})")
        private String branch;

        @Option(names = "--max-retries", defaultValue = "2", description = "Self-heal retries, 0..2 (default: ${DEFAULT-VALUE})")
        private int maxRetries;

        @Option(names = "--mode", defaultValue = "READ_ONLY", description = "READ_ONLY or PR (default: ${DEFAULT-VALUE})")
        private WorkspaceMode mode;

        @Option(names = "--forbid", split = ",", description = "Forbidden path prefixes (default: /infra,/payments)")
        private List<String> forbiddenPaths;

        @Option(names = "--approver", description = "Named approver; repeat for several")
        private List<String> approvers;

        @Option(names = "--approvals", description = "Stop for approval after design")
        private boolean approvals;

        private final WorkspaceStore workspaceStore;

        public Create(WorkspaceStore workspaceStore) {
            this.workspaceStore = workspaceStore;
        }

        @Override
        public void run() {
            ConsoleOutput.printBanner();
            try {
                Workspace workspace = workspaceStore.create(new Workspace(null, team, repo, branch,
                        new Guardrails(maxRetries, mode, forbiddenPaths), approvals, approvers, null, null));
                ConsoleOutput.success("Created workspace " + workspace.workspaceId());
                System.out.println("Repository: " + workspace.repoUrl() + " (" + workspace.branch() + ")");
                System.out.println("Guardrails: " + workspace.guardrails().maxRetries() + " retries, "
                        + workspace.guardrails().mode() + ", forbidden " + workspace.guardrails().forbiddenPaths());
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error(e.getMessage());
            }
        }
    }
}
