package com.hotpreview.core.server;

/**
 * Where a project's preview is reachable.
 *
 * @param port    bound TCP port
 * @param baseUrl preview URL, ending with {@code /}
 */
public record ServerBinding(int port, String baseUrl) {
}
