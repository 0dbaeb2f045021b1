package com.hotpreview.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.URI;

/**
 * CLI command: hotpreview unregister &lt;project-id&gt;
 */
@Command(name = "unregister", mixinStandardHelpOptions = true, description = "Stop previewing a project")
@Component
public class UnregisterCommand extends ServerCommand {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    public UnregisterCommand(PreviewApiClient client) {
        super(client);
    }

    @Override
    protected void execute(URI base) throws IOException, InterruptedException {
        client.unregister(base, projectId);
        ConsoleOutput.success("Project " + projectId + " unregistered");
    }
}
