package com.hotpreview.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.URI;

/**
 * CLI command: hotpreview watch [project-id]
 * <p>
 * Prints a project's channel (or the project catalogue when no id is given) live until the
 * server closes the stream.
 */
@Command(name = "watch", mixinStandardHelpOptions = true, description = "Stream live preview events")
@Component
public class WatchCommand extends ServerCommand {

    @Parameters(index = "0", arity = "0..1", description = "Project ID (omit for the project catalogue)")
    private String projectId;

    public WatchCommand(PreviewApiClient client) {
        super(client);
    }

    @Override
    protected void execute(URI base) throws IOException, InterruptedException {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Watching " + (projectId == null ? "project catalogue" : "project " + projectId)
                + " (connecting to " + server.describe() + ")...");
        System.out.println();
        try {
            client.streamEvents(base, projectId, ConsoleOutput::watchEvent);
        } catch (ApiCallException e) {
            if (e.statusCode() == 404) {
                throw new ApiCallException(404, "Project not found: " + projectId);
            }
            throw e;
        }
        System.out.println();
        ConsoleOutput.info("Stream ended.");
    }
}
