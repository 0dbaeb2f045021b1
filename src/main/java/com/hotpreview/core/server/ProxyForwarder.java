package com.hotpreview.core.server;

import com.hotpreview.core.model.ProxyRule;
import com.sun.net.httpserver.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Forwards a request matched by a {@link ProxyRule} to its upstream and streams the answer back.
 * <p>
 * The full request path and query are appended to the rule's target URL. Method, body and
 * end-to-end headers are forwarded; an unreachable upstream yields 502.
 */
public class ProxyForwarder {

    private static final Logger log = LoggerFactory.getLogger(ProxyForwarder.class);

    /** Hop-by-hop headers plus those {@link HttpClient} manages itself. */
    private static final Set<String> SKIPPED_HEADERS = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization", "te", "trailer",
            "transfer-encoding", "upgrade", "host", "content-length", "expect");

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public ProxyForwarder(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    public static ProxyForwarder create(int connectTimeoutMs, int requestTimeoutMs) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        return new ProxyForwarder(client, Duration.ofMillis(requestTimeoutMs));
    }

    static URI upstreamUri(ProxyRule rule, URI requestUri) {
        String base = rule.targetUrl().endsWith("/")
                ? rule.targetUrl().substring(0, rule.targetUrl().length() - 1)
                : rule.targetUrl();
        String query = requestUri.getRawQuery();
        return URI.create(base + requestUri.getRawPath() + (query == null ? "" : "?" + query));
    }

    /**
     * Proxies the exchange. Always sends a response; never closes the exchange.
     */
    public void forward(ProxyRule rule, HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
        URI target;
        try {
            target = upstreamUri(rule, exchange.getRequestURI());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid proxy target for rule {}: {}", rule.matchPrefix(), e.getMessage());
            sendBadGateway(exchange, "Invalid proxy target");
            return;
        }

        byte[] body;
        try (InputStream in = exchange.getRequestBody()) {
            body = in.readAllBytes();
        }
        HttpRequest.BodyPublisher publisher = body.length == 0
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(body);
        HttpRequest.Builder request = HttpRequest.newBuilder(target)
                .timeout(requestTimeout)
                .method(method, publisher);
        for (Map.Entry<String, List<String>> header : exchange.getRequestHeaders().entrySet()) {
            if (header.getKey() == null || SKIPPED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                continue;
            }
            for (String value : header.getValue()) {
                try {
                    request.header(header.getKey(), value);
                } catch (IllegalArgumentException e) {
                    log.debug("Not forwarding restricted header {}", header.getKey());
                }
            }
        }

        HttpResponse<InputStream> upstream;
        try {
            upstream = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            log.warn("Proxy target {} unreachable: {}", target, e.getMessage());
            sendBadGateway(exchange, "Proxy target unreachable: " + rule.targetUrl());
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sendBadGateway(exchange, "Proxy request interrupted");
            return;
        }

        upstream.headers().map().forEach((name, values) -> {
            if (!SKIPPED_HEADERS.contains(name.toLowerCase(Locale.ROOT)) && !name.startsWith(":")) {
                exchange.getResponseHeaders().put(name, values);
            }
        });
        log.debug("{} {} -> {} ({})", method, exchange.getRequestURI(), target, upstream.statusCode());
        try (InputStream in = upstream.body()) {
            if ("HEAD".equals(method) || upstream.statusCode() == 204 || upstream.statusCode() == 304) {
                exchange.sendResponseHeaders(upstream.statusCode(), -1);
                return;
            }
            exchange.sendResponseHeaders(upstream.statusCode(), 0);
            try (OutputStream out = exchange.getResponseBody()) {
                in.transferTo(out);
            }
        }
    }

    private static void sendBadGateway(HttpExchange exchange, String message) throws IOException {
        StaticResponses.sendText(exchange, 502, message);
    }
}
