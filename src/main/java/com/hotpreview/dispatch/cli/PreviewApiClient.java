package com.hotpreview.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.stream.Stream;

/**
 * HTTP client the CLI commands use to talk to a running {@code hotpreview serve}.
 */
@Component
public class PreviewApiClient {

    private static final Logger log = LoggerFactory.getLogger(PreviewApiClient.class);

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};
    private static final TypeReference<List<Map<String, Object>>> LIST = new TypeReference<>() {};

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public PreviewApiClient() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(), new ObjectMapper());
    }

    PreviewApiClient(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public List<Map<String, Object>> listProjects(URI base) throws IOException, InterruptedException {
        return objectMapper.readValue(call(base, "GET", "/api/v1/projects", null), LIST);
    }

    public Map<String, Object> register(URI base, Map<String, Object> descriptor) throws IOException, InterruptedException {
        return objectMapper.readValue(call(base, "POST", "/api/v1/projects", descriptor), MAP);
    }

    public void unregister(URI base, String projectId) throws IOException, InterruptedException {
        call(base, "DELETE", "/api/v1/projects/" + projectId, null);
    }

    public void rebuild(URI base, String projectId) throws IOException, InterruptedException {
        call(base, "POST", "/api/v1/projects/" + projectId + "/rebuild", null);
    }

    /**
     * Health is reported even when the server answers 503.
     */
    public Map<String, Object> health(URI base) throws IOException, InterruptedException {
        HttpResponse<String> response = send(base, "GET", "/api/v1/health", null);
        return objectMapper.readValue(response.body(), MAP);
    }

    /**
     * Follows an SSE stream until the server closes it, handing each frame's event name and data on.
     *
     * @param projectId project to watch, or {@code null} for the catalogue stream
     */
    public void streamEvents(URI base, String projectId, BiConsumer<String, String> onFrame)
            throws IOException, InterruptedException {
        String path = projectId == null ? "/api/v1/events" : "/api/v1/projects/" + projectId + "/events";
        HttpRequest request = HttpRequest.newBuilder(base.resolve(path))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        HttpResponse<Stream<String>> response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
        if (response.statusCode() != 200) {
            response.body().close();
            throw new ApiCallException(response.statusCode(), "Server returned HTTP " + response.statusCode());
        }

        final String[] currentEvent = {""};
        try (Stream<String> lines = response.body()) {
            lines.forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEvent[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String name = currentEvent[0].isEmpty() ? "message" : currentEvent[0];
                    onFrame.accept(name, line.substring(5).trim());
                    currentEvent[0] = "";
                }
            });
        }
    }

    private String call(URI base, String method, String path, Object body) throws IOException, InterruptedException {
        HttpResponse<String> response = send(base, method, path, body);
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return response.body().isEmpty() ? "{}" : response.body();
        }
        throw new ApiCallException(status, errorMessage(response.body(), status));
    }

    private HttpResponse<String> send(URI base, String method, String path, Object body)
            throws IOException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder(base.resolve(path))
                .timeout(Duration.ofSeconds(30))
                .header("Accept", "application/json");
        if (body == null) {
            request.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            request.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
        }
        log.debug("{} {}", method, path);
        return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private String errorMessage(String body, int status) {
        if (body == null || body.isBlank()) {
            return "HTTP " + status;
        }
        try {
            Object message = objectMapper.readValue(body, MAP).get("message");
            return message != null ? message.toString() : "HTTP " + status;
        } catch (JsonProcessingException e) {
            return "HTTP " + status + ": " + body;
        }
    }
}
