package com.growpad.dispatch.cli;

import com.growpad.core.model.RunStatus;
import com.growpad.core.model.RunSummary;
import picocli.CommandLine;

import java.util.Map;
import java.util.TreeMap;

/**
 * ANSI-colored terminal output utilities for the Growpad CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(green) GROWPAD v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [GROWPAD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void status(RunStatus status) {
        String color = switch (status) {
            case COMPLETED -> "fg(green)";
            case FAILED, CANCELLED -> "fg(red)";
            case AWAITING_APPROVAL, RETRYING -> "fg(yellow)";
            default -> "fg(cyan)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "Status: @|bold," + color + " " + status + "|@"));
    }

    public static void summary(RunSummary summary) {
        System.out.println();
        System.out.println("RUN " + summary.runId());
        System.out.println("Workspace: " + summary.workspaceId());
        status(summary.status());
        if (summary.currentStage() != null) {
            System.out.println("Stage: " + summary.currentStage());
        }
        System.out.println("Retries: " + summary.retryCount());
        if (!summary.approvalState().isEmpty()) {
            System.out.println("Approvals:");
            summary.approvalState().forEach((who, decision) ->
                    System.out.println("  " + who + ": " + decision));
        }
        if (summary.failureCause() != null) {
            error("Failure: " + summary.failureCause() + " (" + summary.lastError() + ")");
        }
        if (!summary.outputsIndex().isEmpty()) {
            System.out.println();
            System.out.printf("  %-20s %s%n", "OUTPUT", "PATH");
            System.out.println("  " + "-".repeat(50));
            for (Map.Entry<String, String> e : new TreeMap<>(summary.outputsIndex()).entrySet()) {
                System.out.printf("  %-20s %s%n", e.getKey(), e.getValue());
            }
        }
    }
}
