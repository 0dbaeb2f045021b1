package com.hotpreview.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.URI;

/**
 * CLI command: hotpreview rebuild &lt;project-id&gt;
 */
@Command(name = "rebuild", mixinStandardHelpOptions = true, description = "Trigger a manual rebuild")
@Component
public class RebuildCommand extends ServerCommand {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    public RebuildCommand(PreviewApiClient client) {
        super(client);
    }

    @Override
    protected void execute(URI base) throws IOException, InterruptedException {
        client.rebuild(base, projectId);
        ConsoleOutput.success("Rebuild queued for " + projectId);
    }
}
