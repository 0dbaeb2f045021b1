package com.hotpreview.core.model;

import java.time.Instant;

/**
 * Live runtime view of one registered project.
 *
 * @param projectId project id
 * @param name      display name
 * @param port      port of the project's HTTP endpoint ({@code 0} before binding)
 * @param baseUrl   preview URL ({@code null} before binding)
 * @param status    session status
 * @param startedAt when the session was created
 * @param lastError last watcher or startup error ({@code null} when healthy)
 */
public record PreviewSession(
    String projectId,
    String name,
    int port,
    String baseUrl,
    SessionStatus status,
    Instant startedAt,
    String lastError
) {

    public static PreviewSession starting(Project project) {
        return new PreviewSession(project.id(), project.name(), 0, null, SessionStatus.STARTING, Instant.now(), null);
    }

    public PreviewSession ready(int port, String baseUrl) {
        return new PreviewSession(projectId, name, port, baseUrl, SessionStatus.READY, startedAt, null);
    }

    public PreviewSession error(String message) {
        return new PreviewSession(projectId, name, port, baseUrl, SessionStatus.ERROR, startedAt, message);
    }

    public PreviewSession stopped() {
        return new PreviewSession(projectId, name, port, baseUrl, SessionStatus.STOPPED, startedAt, lastError);
    }
}
