package com.hotpreview.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * CLI command: hotpreview health
 * <p>
 * Fetches the server's component health and prints it with colored output.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check server health")
@Component
public class HealthCommand extends ServerCommand {

    public HealthCommand(PreviewApiClient client) {
        super(client);
    }

    @Override
    @SuppressWarnings("unchecked")
    protected void execute(URI base) throws IOException, InterruptedException {
        ConsoleOutput.printBanner();
        Map<String, Object> health = client.health(base);
        Object components = health.getOrDefault("components", Map.of());
        if (components instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                Map<String, Object> info = (Map<String, Object>) entry.getValue();
                String label = entry.getKey() + ": " + info.get("detail");
                switch (String.valueOf(info.get("status"))) {
                    case "UP" -> ConsoleOutput.success(label);
                    case "DOWN" -> ConsoleOutput.error(label);
                    default -> ConsoleOutput.info(label);
                }
            }
        }
        System.out.println("──────────────────────────────────");
        if ("UP".equals(health.get("status"))) {
            ConsoleOutput.success("Overall: all systems operational");
        } else {
            ConsoleOutput.error("Overall: " + health.get("status"));
        }
    }
}
