package com.growpad.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final GrowpadCommand growpadCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(GrowpadCommand growpadCommand, IFactory factory) {
        this.growpadCommand = growpadCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // In serve mode the embedded web server keeps the JVM alive; picocli would return at once.
        for (String arg : args) {
            if (ServeCommand.NAME.equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(growpadCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
