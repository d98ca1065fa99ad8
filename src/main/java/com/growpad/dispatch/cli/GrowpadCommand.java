package com.growpad.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Growpad.
 * Routes to subcommands: serve, workspace, run, status.
 */
@Command(
        name = "growpad",
        mixinStandardHelpOptions = true,
        version = "Growpad 0.1.0",
        description = "Turns customer evidence into a verified code change",
        subcommands = {
                ServeCommand.class,
                WorkspaceCommand.class,
                RunCommand.class,
                StatusCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class GrowpadCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
