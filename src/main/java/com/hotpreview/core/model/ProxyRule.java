package com.hotpreview.core.model;

import java.util.Objects;

/**
 * Forwards requests whose path starts with {@code matchPrefix} to {@code targetUrl}.
 *
 * @param matchPrefix request path prefix, always starting with {@code /}
 * @param targetUrl   base URL of the upstream server (e.g. {@code http://localhost:5173})
 */
public record ProxyRule(String matchPrefix, String targetUrl) {

    public ProxyRule {
        Objects.requireNonNull(matchPrefix, "matchPrefix");
        Objects.requireNonNull(targetUrl, "targetUrl");
        if (!matchPrefix.startsWith("/")) {
            matchPrefix = "/" + matchPrefix;
        }
    }

    public boolean matches(String requestPath) {
        return requestPath.startsWith(matchPrefix);
    }
}
