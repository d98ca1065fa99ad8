package com.growpad.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: growpad serve
 * <p>
 * Starts the HTTP server exposing the REST API and SSE event streams. The web server is
 * enabled by {@link com.growpad.GrowpadApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli in that mode. The banner is printed once Tomcat is ready.
 */
@Command(name = ServeCommand.NAME, mixinStandardHelpOptions = true,
        description = "Start the Growpad HTTP server")
@Component
public class ServeCommand implements Runnable {

    static final String NAME = "serve";

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Growpad server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Health:  http://localhost:" + port + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
