package com.growpad.dispatch.cli;

import com.growpad.core.engine.RunOrchestrator;
import com.growpad.core.model.ApprovalDecision;
import com.growpad.core.model.FailureCause;
import com.growpad.core.model.Guardrails;
import com.growpad.core.model.RunRequest;
import com.growpad.core.model.RunStatus;
import com.growpad.core.model.RunSummary;
import com.growpad.core.model.StageId;
import com.growpad.core.model.Workspace;
import com.growpad.core.model.WorkspaceMode;
import com.growpad.core.store.RunNotFoundException;
import com.growpad.core.store.WorkspaceNotFoundException;
import com.growpad.core.store.WorkspaceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Exercises picocli directly without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private RunOrchestrator orchestrator;
    private WorkspaceStore workspaceStore;

    @BeforeEach
    void setUp() {
        orchestrator = mock(RunOrchestrator.class);
        workspaceStore = mock(WorkspaceStore.class);
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(orchestrator);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(orchestrator);
                }
                if (cls == WorkspaceCommand.Create.class) {
                    return (K) new WorkspaceCommand.Create(workspaceStore);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new GrowpadCommand(), factory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static RunSummary summary(RunStatus status, FailureCause cause, String error) {
        return new RunSummary("run_0123456789ab", "ws_0123456789ab", status, StageId.EXPORT, 1,
                Map.of("prd", "artifacts/PRD.md"), Map.of("alice", ApprovalDecision.APPROVED), cause, error);
    }

    // =====================================================================
    //  Help output
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String name : List.of("serve", "workspace", "run", "status", "help")) {
                assertTrue(result.output().contains(name), "Help should list '" + name + "'");
            }
            assertTrue(result.output().contains("Turns customer evidence into a verified code change"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Growpad 0.1.0"));
        }

        @Test
        @DisplayName("run without a workspace id is a usage error")
        void runRequiresWorkspace() {
            CliResult result = execute("run");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }
    }

    // =====================================================================
    //  workspace create
    // =====================================================================

    @Nested
    @DisplayName("workspace create")
    class WorkspaceCreateTests {

        @Test
        @DisplayName("passes guardrails and approvers to the store")
        void createsWorkspace() {
            Instant now = Instant.now();
            when(workspaceStore.create(any(Workspace.class))).thenAnswer(inv -> {
                Workspace draft = inv.getArgument(0);
                return new Workspace("ws_0123456789ab", draft.teamName(), draft.repoUrl(), draft.branch(),
                        draft.guardrails(), draft.approvalWorkflowEnabled(), draft.approvers(), now, now);
            });

            CliResult result = execute("workspace", "create", "--team", "growth", "--repo", "local://shop",
                    "--max-retries", "1", "--mode", "PR", "--forbid", "/infra,/billing",
                    "--approver", "alice", "--approver", "bob", "--approvals");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Created workspace ws_0123456789ab"));
            ArgumentCaptor<Workspace> draft = ArgumentCaptor.forClass(Workspace.class);
            verify(workspaceStore).create(draft.capture());
            Guardrails guardrails = draft.getValue().guardrails();
            assertEquals(1, guardrails.maxRetries());
            assertEquals(WorkspaceMode.PR, guardrails.mode());
            assertEquals(List.of("/infra", "/billing"), guardrails.forbiddenPaths());
            assertEquals(List.of("alice", "bob"), draft.getValue().approvers());
            assertTrue(draft.getValue().approvalWorkflowEnabled());
        }

        @Test
        @DisplayName("rejected configuration is reported")
        void rejected() {
            when(workspaceStore.create(any(Workspace.class)))
                    .thenThrow(new IllegalArgumentException("max_retries must be between 0 and 2, got 7"));

            CliResult result = execute("workspace", "create", "--team", "growth", "--repo", "local://shop",
                    "--max-retries", "7");

            assertTrue(result.output().contains("max_retries must be between 0 and 2"));
        }
    }

    // =====================================================================
    //  run
    // =====================================================================

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("starts a fast-mode run and returns immediately")
        void startsRun() {
            when(orchestrator.start(any(RunRequest.class)))
                    .thenReturn(summary(RunStatus.PENDING, null, null));

            CliResult result = execute("run", "ws_0123456789ab", "--feature", "1", "--goal", "Grow activation");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Started run run_0123456789ab"));
            verify(orchestrator).start(new RunRequest("ws_0123456789ab", null, "Grow activation", true, 1));
        }

        @Test
        @DisplayName("--wait exits 0 when the run completes")
        void waitCompleted() throws Exception {
            when(orchestrator.start(any(RunRequest.class)))
                    .thenReturn(summary(RunStatus.PENDING, null, null));
            when(orchestrator.awaitCompletion(eq("run_0123456789ab"), any(Duration.class)))
                    .thenReturn(summary(RunStatus.COMPLETED, null, null));

            CliResult result = execute("run", "ws_0123456789ab", "--wait");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("COMPLETED"));
            assertTrue(result.output().contains("artifacts/PRD.md"));
            assertTrue(result.output().contains("alice: APPROVED"));
        }

        @Test
        @DisplayName("--wait exits 1 when the run fails")
        void waitFailed() throws Exception {
            when(orchestrator.start(any(RunRequest.class)))
                    .thenReturn(summary(RunStatus.PENDING, null, null));
            when(orchestrator.awaitCompletion(eq("run_0123456789ab"), any(Duration.class)))
                    .thenReturn(summary(RunStatus.FAILED, FailureCause.VERIFICATION, "2 tests failed"));

            CliResult result = execute("run", "ws_0123456789ab", "--wait", "--timeout", "PT5M");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Failure: VERIFICATION (2 tests failed)"));
            verify(orchestrator).awaitCompletion("run_0123456789ab", Duration.ofMinutes(5));
        }

        @Test
        @DisplayName("--wait exits 1 on timeout")
        void waitTimeout() throws Exception {
            when(orchestrator.start(any(RunRequest.class)))
                    .thenReturn(summary(RunStatus.PENDING, null, null));
            when(orchestrator.awaitCompletion(eq("run_0123456789ab"), any(Duration.class)))
                    .thenThrow(new TimeoutException());

            CliResult result = execute("run", "ws_0123456789ab", "--wait", "--timeout", "PT1S");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("still executing"));
        }

        @Test
        @DisplayName("unknown workspace exits 2 without waiting")
        void unknownWorkspace() throws Exception {
            when(orchestrator.start(any(RunRequest.class)))
                    .thenThrow(new WorkspaceNotFoundException("ws_missing"));

            CliResult result = execute("run", "ws_missing", "--wait");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Workspace not found: ws_missing"));
            verify(orchestrator, never()).awaitCompletion(any(), any());
        }
    }

    // =====================================================================
    //  status
    // =====================================================================

    @Nested
    @DisplayName("status")
    class StatusTests {

        @Test
        @DisplayName("prints the run summary")
        void printsSummary() {
            when(orchestrator.status("run_0123456789ab"))
                    .thenReturn(summary(RunStatus.AWAITING_APPROVAL, null, null));

            CliResult result = execute("status", "run_0123456789ab");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("RUN run_0123456789ab"));
            assertTrue(result.output().contains("AWAITING_APPROVAL"));
            assertTrue(result.output().contains("Retries: 1"));
        }

        @Test
        @DisplayName("unknown run is reported")
        void unknownRun() {
            when(orchestrator.status("run_missing")).thenThrow(new RunNotFoundException("run_missing"));

            CliResult result = execute("status", "run_missing");

            assertTrue(result.output().contains("Run not found: run_missing"));
        }
    }
}
