package com.hotpreview.core.server;

import com.hotpreview.core.logging.MdcContext;
import com.hotpreview.core.metrics.PreviewMetrics;
import com.hotpreview.core.model.Project;
import com.hotpreview.core.model.ProxyRule;
import com.hotpreview.core.security.AccessOperation;
import com.hotpreview.core.security.PermissionCheck;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP endpoint of one project on its own ephemeral port.
 * <p>
 * Requests are matched against the proxy rules in declaration order; the first matching
 * prefix wins. Everything else is served read-only from the project root, falling back to
 * the entry document for paths with no file (single-page-app routing). Paths that escape
 * the root, or that the permission check refuses, are answered with 403 without touching
 * the file. Permission decisions are cached for the life of the server.
 */
public class ProjectServer {

    private static final Logger log = LoggerFactory.getLogger(ProjectServer.class);

    private final String host;
    private final String entryDocument;
    private final PermissionCheck permissionCheck;
    private final ProxyForwarder proxyForwarder;
    private final PreviewMetrics metrics;

    private final Map<Path, Boolean> permissionDecisions = new ConcurrentHashMap<>();

    private volatile Project project;
    private Path root;
    private Path realRoot;
    private HttpServer server;
    private ExecutorService executor;
    private ServerBinding binding;

    public ProjectServer(String host, String entryDocument, PermissionCheck permissionCheck,
                         ProxyForwarder proxyForwarder, PreviewMetrics metrics) {
        this.host = host;
        this.entryDocument = entryDocument;
        this.permissionCheck = permissionCheck;
        this.proxyForwarder = proxyForwarder;
        this.metrics = metrics;
    }

    /**
     * Binds a fresh ephemeral port and starts serving. Calling it again returns the existing binding.
     *
     * @throws PortUnavailableException if no port can be bound
     */
    public synchronized ServerBinding start(Project project) {
        if (binding != null) {
            return binding;
        }
        this.project = project;
        this.root = project.rootPath();
        try {
            this.realRoot = root.toRealPath();
        } catch (IOException e) {
            this.realRoot = root;
        }

        HttpServer created = null;
        ExecutorService pool = null;
        try {
            created = HttpServer.create(new InetSocketAddress(host, 0), 0);
            AtomicInteger counter = new AtomicInteger();
            String projectId = project.id();
            pool = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "preview-" + projectId + "-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            created.createContext("/", this::handle);
            created.setExecutor(pool);
            created.start();
        } catch (IOException | RuntimeException e) {
            if (created != null) {
                created.stop(0);
            }
            if (pool != null) {
                pool.shutdownNow();
            }
            throw new PortUnavailableException("Cannot bind a preview port on " + host + ": " + e.getMessage(), e);
        }

        server = created;
        executor = pool;
        int port = created.getAddress().getPort();
        binding = new ServerBinding(port, "http://" + host + ":" + port + "/");
        log.info("Preview server for project {} listening on {}", project.id(), binding.baseUrl());
        return binding;
    }

    /**
     * Releases the port and request threads. Idempotent.
     */
    public synchronized void stop() {
        if (server == null) {
            return;
        }
        try {
            server.stop(0);
        } finally {
            executor.shutdownNow();
            server = null;
            executor = null;
            permissionDecisions.clear();
            log.info("Preview server for project {} stopped (port {})", project.id(), binding.port());
            binding = null;
        }
    }

    /**
     * Replaces the proxy rules used for subsequent requests.
     */
    public void updateProject(Project updated) {
        this.project = updated;
    }

    public synchronized Optional<ServerBinding> binding() {
        return Optional.ofNullable(binding);
    }

    private void handle(HttpExchange exchange) {
        MdcContext.setProject(project.id());
        try {
            String path = exchange.getRequestURI().getPath();
            if (path == null || path.isEmpty()) {
                path = "/";
            }
            for (ProxyRule rule : project.proxyRules()) {
                if (rule.matches(path)) {
                    proxyForwarder.forward(rule, exchange);
                    return;
                }
            }
            serveStatic(exchange, path);
        } catch (IOException e) {
            log.debug("Request {} aborted: {}", exchange.getRequestURI(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error serving {}", exchange.getRequestURI(), e);
            trySend(exchange, 500, "Internal error");
        } finally {
            exchange.close();
            MdcContext.clear();
        }
    }

    private void serveStatic(HttpExchange exchange, String path) throws IOException {
        String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
        if (!"GET".equals(method) && !"HEAD".equals(method)) {
            exchange.getResponseHeaders().set("Allow", "GET, HEAD");
            StaticResponses.sendText(exchange, 405, "Method not allowed");
            return;
        }

        Path file;
        try {
            file = resolve(path);
            if (file == null) {
                file = fallback();
            }
        } catch (ServeDeniedException e) {
            if (metrics != null) {
                metrics.recordServeDenied(e.reason().name().toLowerCase(Locale.ROOT));
            }
            log.warn("Denied {} for project {}: {}", path, project.id(), e.getMessage());
            StaticResponses.sendText(exchange, 403, "Forbidden");
            return;
        }

        if (file == null) {
            StaticResponses.sendText(exchange, 404, "Not found: " + path);
            return;
        }
        sendFile(exchange, file, "HEAD".equals(method));
    }

    /**
     * Maps a request path to a servable file under the root.
     *
     * @return the file, or {@code null} if nothing exists there
     * @throws ServeDeniedException if the path escapes the root or access is refused
     */
    Path resolve(String requestPath) {
        String relative = requestPath;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        Path candidate;
        try {
            candidate = root.resolve(relative).normalize();
        } catch (InvalidPathException e) {
            throw new ServeDeniedException(ServeDeniedException.Reason.TRAVERSAL, "Invalid path " + requestPath);
        }
        if (!candidate.startsWith(root)) {
            throw new ServeDeniedException(ServeDeniedException.Reason.TRAVERSAL,
                    "Path escapes project root: " + requestPath);
        }
        if (Files.isDirectory(candidate)) {
            candidate = candidate.resolve(entryDocument);
        }
        if (!Files.isRegularFile(candidate)) {
            return null;
        }
        checkAccess(candidate);
        return candidate;
    }

    private Path fallback() {
        Path entry = root.resolve(entryDocument);
        if (!Files.isRegularFile(entry)) {
            return null;
        }
        checkAccess(entry);
        return entry;
    }

    private void checkAccess(Path file) {
        Path real;
        try {
            real = file.toRealPath();
        } catch (IOException e) {
            throw new ServeDeniedException(ServeDeniedException.Reason.PERMISSION, "Cannot resolve " + file);
        }
        if (!real.startsWith(realRoot)) {
            throw new ServeDeniedException(ServeDeniedException.Reason.TRAVERSAL,
                    "Link leads outside project root: " + file);
        }
        boolean allowed = permissionDecisions.computeIfAbsent(real,
                p -> permissionCheck.canAccess(p, AccessOperation.SERVE));
        if (!allowed) {
            throw new ServeDeniedException(ServeDeniedException.Reason.PERMISSION, "Access refused for " + file);
        }
    }

    private void sendFile(HttpExchange exchange, Path file, boolean headOnly) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", ContentTypes.of(file));
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        if (headOnly) {
            exchange.sendResponseHeaders(200, -1);
            return;
        }
        long size;
        try {
            size = Files.size(file);
        } catch (NoSuchFileException e) {
            StaticResponses.sendText(exchange, 404, "Not found");
            return;
        }
        exchange.sendResponseHeaders(200, size == 0 ? -1 : size);
        if (size == 0) {
            return;
        }
        try (InputStream in = Files.newInputStream(file); OutputStream out = exchange.getResponseBody()) {
            in.transferTo(out);
        }
    }

    private void trySend(HttpExchange exchange, int status, String message) {
        try {
            StaticResponses.sendText(exchange, status, message);
        } catch (IOException | RuntimeException e) {
            log.debug("Could not send {} for {}: {}", status, exchange.getRequestURI(), e.getMessage());
        }
    }
}
