package com.hotpreview.core.events;

import com.hotpreview.core.model.ChangeEvent;
import com.hotpreview.core.model.PreviewSession;
import com.hotpreview.core.model.RebuildJob;
import com.hotpreview.core.model.RebuildOutcome;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A message pushed to client channels, serialized to JSON on the wire.
 *
 * @param type      message variant
 * @param projectId project the message is about ({@code null} only for {@code projects-list})
 * @param payload   variant-specific fields
 * @param timestamp when the message was created
 */
public record PreviewMessage(
    MessageType type,
    String projectId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public PreviewMessage {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static PreviewMessage projectAdded(PreviewSession session) {
        return new PreviewMessage(MessageType.PROJECT_ADDED, session.projectId(), describe(session), null);
    }

    public static PreviewMessage projectRemoved(String projectId) {
        return new PreviewMessage(MessageType.PROJECT_REMOVED, projectId, Map.of(), null);
    }

    public static PreviewMessage projectState(PreviewSession session) {
        Map<String, Object> payload = describe(session);
        payload.put("port", session.port());
        return new PreviewMessage(MessageType.PROJECT_STATE, session.projectId(), payload, null);
    }

    public static PreviewMessage projectsList(List<PreviewSession> sessions) {
        List<Map<String, Object>> projects = sessions.stream().map(PreviewMessage::describe).toList();
        return new PreviewMessage(MessageType.PROJECTS_LIST, null, Map.of("projects", projects), null);
    }

    public static PreviewMessage fileChange(ChangeEvent event) {
        return new PreviewMessage(MessageType.FILE_CHANGE, event.projectId(), Map.of(
                "relativePath", event.relativePath(),
                "kind", event.kind().wireName()), null);
    }

    public static PreviewMessage rebuildStarted(RebuildJob job) {
        return new PreviewMessage(MessageType.REBUILD_STARTED, job.projectId(), Map.of(
                "jobId", job.id(),
                "trigger", job.trigger().wireName(),
                "fileCount", job.affectedPaths().size()), null);
    }

    public static PreviewMessage rebuildComplete(RebuildOutcome outcome) {
        RebuildJob job = outcome.job();
        List<String> files = job.affectedPaths();
        return new PreviewMessage(MessageType.REBUILD_COMPLETE, outcome.projectId(), Map.of(
                "jobId", job.id(),
                "trigger", job.trigger().wireName(),
                "durationMs", outcome.duration().toMillis(),
                "fileCount", files.size(),
                "files", files), null);
    }

    public static PreviewMessage rebuildError(RebuildOutcome outcome) {
        RebuildJob job = outcome.job();
        return new PreviewMessage(MessageType.REBUILD_ERROR, outcome.projectId(), Map.of(
                "jobId", job.id(),
                "trigger", job.trigger().wireName(),
                "durationMs", outcome.duration().toMillis(),
                "message", job.error() != null ? job.error() : "rebuild failed",
                "timedOut", job.timedOut()), null);
    }

    public static PreviewMessage watcherError(String projectId, String message) {
        return new PreviewMessage(MessageType.WATCHER_ERROR, projectId,
                Map.of("message", message != null ? message : "watcher stopped"), null);
    }

    /**
     * Flattened JSON shape: {@code type}, {@code projectId}, the payload fields and {@code timestamp}.
     */
    public Map<String, Object> toWire() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", type.wireName());
        if (projectId != null) {
            data.put("projectId", projectId);
        }
        data.putAll(payload);
        data.put("timestamp", timestamp.toString());
        return data;
    }

    private static Map<String, Object> describe(PreviewSession session) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("id", session.projectId());
        info.put("name", session.name());
        info.put("previewUrl", session.baseUrl() != null ? session.baseUrl() : "");
        info.put("status", session.status().wireName());
        return info;
    }
}
