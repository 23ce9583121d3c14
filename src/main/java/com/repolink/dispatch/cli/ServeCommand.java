package com.repolink.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: repolink serve
 * <p>
 * Starts the HTTP API. {@link LaunchMode} enables the web server for a
 * leading "serve" argument and {@link CliRunner} skips picocli in that mode.
 * The banner is printed once Tomcat reports its port.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 repolink serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Repolink HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through picocli, e.g. from tests
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Repolink server running on port " + port);
        System.out.println();
        System.out.println("  Index:   http://localhost:" + port + "/");
        System.out.println("  API:     http://localhost:" + port + "/v1");
        System.out.println("  Health:  http://localhost:" + port + "/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
