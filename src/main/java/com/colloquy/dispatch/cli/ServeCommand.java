package com.colloquy.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: colloquy serve
 * <p>
 * Starts Colloquy as a long-running HTTP server exposing the REST API and SSE
 * streams. {@link LaunchMode#SERVE} enables the web server and makes {@link CliRunner}
 * skip picocli; the banner is printed once the server is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Colloquy HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; see CliRunner.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Colloquy server running on port " + port);
        System.out.println();
        System.out.println("  API:      http://localhost:" + port + "/api/v1/conversations");
        System.out.println("  Health:   http://localhost:" + port + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
