package com.hotpreview.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class PreviewApiClientTest {

    private HttpServer server;
    private URI base;
    private PreviewApiClient client;
    private final AtomicReference<String> lastRequest = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        base = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
        client = new PreviewApiClient(HttpClient.newHttpClient(), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void respond(String path, int status, String contentType, String body) {
        server.createContext(path, exchange -> {
            String requestBody = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            lastRequest.set(exchange.getRequestMethod() + " " + exchange.getRequestURI() + " " + requestBody);
            write(exchange, status, contentType, body);
        });
    }

    private static void write(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    @Test
    @DisplayName("register posts the descriptor as JSON")
    void register() throws Exception {
        respond("/api/v1/projects", 200, "application/json",
                "{\"id\":\"site\",\"previewUrl\":\"http://localhost:41234/\",\"status\":\"ready\"}");

        Map<String, Object> session = client.register(base, Map.of("rootPath", "/tmp/site"));

        assertEquals("http://localhost:41234/", session.get("previewUrl"));
        assertEquals("POST /api/v1/projects {\"rootPath\":\"/tmp/site\"}", lastRequest.get());
    }

    @Test
    @DisplayName("error responses surface the server's message and status")
    void errorMessage() {
        respond("/api/v1/projects/ghost", 404, "application/json",
                "{\"error\":\"NOT_FOUND\",\"message\":\"Project not registered: ghost\",\"retryable\":false}");

        var ex = assertThrows(ApiCallException.class, () -> client.unregister(base, "ghost"));
        assertEquals(404, ex.statusCode());
        assertEquals("Project not registered: ghost", ex.getMessage());
    }

    @Test
    @DisplayName("an empty success body is accepted")
    void emptyBody() throws Exception {
        respond("/api/v1/projects/site", 204, "application/json", "");
        assertDoesNotThrow(() -> client.unregister(base, "site"));
        assertTrue(lastRequest.get().startsWith("DELETE /api/v1/projects/site"));
    }

    @Test
    @DisplayName("health is read even from a 503")
    void healthDown() throws Exception {
        respond("/api/v1/health", 503, "application/json", "{\"status\":\"DOWN\",\"components\":{}}");
        assertEquals("DOWN", client.health(base).get("status"));
    }

    @Test
    @DisplayName("event streams are split into named frames")
    void streamEvents() throws Exception {
        respond("/api/v1/projects/site/events", 200, "text/event-stream",
                ":connected\n\n"
                        + "event:project-state\ndata:{\"type\":\"project-state\"}\n\n"
                        + "event:file-change\ndata:{\"type\":\"file-change\",\"relativePath\":\"a.txt\"}\n\n");

        List<String> frames = new ArrayList<>();
        client.streamEvents(base, "site", (name, data) -> frames.add(name + " " + data));

        assertEquals(List.of(
                "project-state {\"type\":\"project-state\"}",
                "file-change {\"type\":\"file-change\",\"relativePath\":\"a.txt\"}"), frames);
    }

    @Test
    @DisplayName("a rejected stream raises with the status")
    void streamRejected() {
        respond("/api/v1/projects/ghost/events", 404, "application/json", "{}");
        var ex = assertThrows(ApiCallException.class,
                () -> client.streamEvents(base, "ghost", (name, data) -> { }));
        assertEquals(404, ex.statusCode());
    }
}
