package com.hotpreview.dispatch.cli;

import picocli.CommandLine.Option;

import java.net.URI;

/**
 * Where the running HotPreview server listens. Shared by every client-side command.
 */
public class ServerOptions {

    @Option(names = {"--host"}, description = "Server host (default: ${DEFAULT-VALUE})", defaultValue = "localhost")
    String host = "localhost";

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    int port = 8080;

    public URI baseUri() {
        return URI.create("http://" + host + ":" + port);
    }

    public String describe() {
        return host + ":" + port;
    }
}
