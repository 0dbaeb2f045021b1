package com.hotpreview.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI command: hotpreview register &lt;root&gt;
 * <p>
 * Registers a project directory with the running server and prints its preview URL.
 */
@Command(name = "register", mixinStandardHelpOptions = true, description = "Register a project for live preview")
@Component
public class RegisterCommand extends ServerCommand {

    @Parameters(index = "0", description = "Project root directory")
    private Path root;

    @Option(names = {"--id"}, description = "Project id (generated when omitted)")
    private String id;

    @Option(names = {"--name", "-n"}, description = "Display name")
    private String name;

    @Option(names = {"--proxy"}, description = "Proxy rule prefix=url, e.g. /api=http://localhost:3000 (repeatable)")
    private List<String> proxies = new ArrayList<>();

    @Option(names = {"--compile", "-c"}, description = "Compile command run on every rebuild")
    private String compile;

    @Option(names = {"--compile-timeout"}, description = "Compile step timeout in seconds (server default when omitted)")
    private Integer compileTimeout;

    public RegisterCommand(PreviewApiClient client) {
        super(client);
    }

    @Override
    protected void execute(URI base) throws IOException, InterruptedException {
        Map<String, Object> session = client.register(base, descriptor());
        ConsoleOutput.success("Project " + session.get("id") + " registered (" + session.get("status") + ")");
        ConsoleOutput.info("Preview: " + session.get("previewUrl"));
    }

    Map<String, Object> descriptor() {
        Map<String, Object> body = new LinkedHashMap<>();
        if (id != null) {
            body.put("id", id);
        }
        if (name != null) {
            body.put("name", name);
        }
        body.put("rootPath", root.toAbsolutePath().normalize().toString());

        List<Map<String, String>> rules = new ArrayList<>();
        for (String proxy : proxies) {
            int eq = proxy.indexOf('=');
            if (eq <= 0 || eq == proxy.length() - 1) {
                throw new IllegalArgumentException("Proxy rule must be prefix=url: " + proxy);
            }
            rules.add(Map.of("matchPrefix", proxy.substring(0, eq), "targetUrl", proxy.substring(eq + 1)));
        }
        body.put("proxyRules", rules);

        if (compile != null) {
            Map<String, Object> step = new LinkedHashMap<>();
            step.put("command", compile);
            if (compileTimeout != null) {
                step.put("timeoutSeconds", compileTimeout);
            }
            body.put("compileStep", step);
        }
        return body;
    }
}
