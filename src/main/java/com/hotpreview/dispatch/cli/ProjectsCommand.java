package com.hotpreview.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * CLI command: hotpreview projects
 */
@Command(name = "projects", mixinStandardHelpOptions = true, description = "List registered projects")
@Component
public class ProjectsCommand extends ServerCommand {

    public ProjectsCommand(PreviewApiClient client) {
        super(client);
    }

    @Override
    protected void execute(URI base) throws IOException, InterruptedException {
        List<Map<String, Object>> projects = client.listProjects(base);
        if (projects.isEmpty()) {
            ConsoleOutput.info("No projects registered.");
            return;
        }
        System.out.printf("  %-14s %-20s %-10s %s%n", "ID", "NAME", "STATUS", "PREVIEW URL");
        System.out.println("  " + "-".repeat(70));
        for (Map<String, Object> p : projects) {
            System.out.printf("  %-14s %-20s ", p.get("id"), truncate(String.valueOf(p.get("name")), 20));
            ConsoleOutput.status(String.valueOf(p.get("status")));
            System.out.printf("%s %s%n", " ".repeat(Math.max(1, 11 - String.valueOf(p.get("status")).length())),
                    p.get("previewUrl"));
        }
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
