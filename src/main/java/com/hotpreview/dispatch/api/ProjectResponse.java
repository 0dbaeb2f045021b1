package com.hotpreview.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.hotpreview.core.model.PreviewSession;

/**
 * Outbound JSON for a single preview session.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectResponse(
    String id,
    String name,
    String previewUrl,
    int port,
    String status,
    String startedAt,
    String lastError
) {

    public static ProjectResponse from(PreviewSession session) {
        return new ProjectResponse(
                session.projectId(),
                session.name(),
                session.baseUrl(),
                session.port(),
                session.status().wireName(),
                session.startedAt().toString(),
                session.lastError());
    }
}
