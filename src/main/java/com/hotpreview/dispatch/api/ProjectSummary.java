package com.hotpreview.dispatch.api;

import com.hotpreview.core.model.PreviewSession;

/**
 * One row of GET /api/v1/projects.
 */
public record ProjectSummary(String id, String name, String previewUrl, String status) {

    public static ProjectSummary from(PreviewSession session) {
        return new ProjectSummary(session.projectId(), session.name(),
                session.baseUrl() == null ? "" : session.baseUrl(), session.status().wireName());
    }
}
