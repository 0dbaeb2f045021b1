package com.hotpreview.dispatch.cli;

import picocli.CommandLine;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;

/**
 * Base for commands that act on a running server through {@link PreviewApiClient}.
 * Connection and API failures are reported on the console and set a non-zero exit code.
 */
public abstract class ServerCommand implements Runnable, CommandLine.IExitCodeGenerator {

    @Mixin
    protected ServerOptions server = new ServerOptions();

    protected final PreviewApiClient client;

    private int exitCode;

    protected ServerCommand(PreviewApiClient client) {
        this.client = client;
    }

    @Override
    public void run() {
        try {
            execute(server.baseUri());
        } catch (ConnectException e) {
            exitCode = 2;
            ConsoleOutput.error("Cannot connect to HotPreview server at " + server.describe());
            ConsoleOutput.info("Start the server first: hotpreview serve");
        } catch (ApiCallException e) {
            exitCode = 1;
            ConsoleOutput.error(e.getMessage() + " (HTTP " + e.statusCode() + ")");
        } catch (IllegalArgumentException e) {
            exitCode = 2;
            ConsoleOutput.error(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exitCode = 130;
            ConsoleOutput.info("Interrupted.");
        } catch (IOException e) {
            exitCode = 1;
            ConsoleOutput.error("Request failed: " + e.getMessage());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    protected abstract void execute(URI base) throws IOException, InterruptedException;
}
