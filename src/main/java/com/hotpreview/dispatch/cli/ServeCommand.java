package com.hotpreview.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: hotpreview serve
 * <p>
 * Starts HotPreview as a long-running server exposing the registration API and the
 * event streams. The web server is enabled by {@link com.hotpreview.HotPreviewApplication#main}
 * detecting "serve" in args; {@link CliRunner} then skips picocli so the embedded server
 * keeps the JVM alive. The banner is printed once Tomcat is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 hotpreview serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the HotPreview server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // only reached through --help style invocations; CliRunner skips picocli for serve
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("HotPreview server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1/projects");
        System.out.println("  Events:  http://localhost:" + port + "/api/v1/events");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
