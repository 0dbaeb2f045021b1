package com.hotpreview.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One logical "respond to a batch of changes" unit for a project.
 * <p>
 * Immutable snapshot; each state transition returns a new instance. A file-change job
 * always carries at least one triggering event.
 *
 * @param id               job id, unique per process
 * @param projectId        owning project
 * @param trigger          what caused the job
 * @param triggeringEvents change events folded into this job, in arrival order
 * @param queuedAt         when the job was first queued
 * @param startedAt        when it began running ({@code null} while queued)
 * @param status           current status
 * @param error            failure text, bounded in size ({@code null} unless failed)
 * @param timedOut         whether the failure was a compile step timeout
 * @param finishedAt       when it reached a terminal status
 */
public record RebuildJob(
    String id,
    String projectId,
    RebuildTrigger trigger,
    List<ChangeEvent> triggeringEvents,
    Instant queuedAt,
    Instant startedAt,
    RebuildStatus status,
    String error,
    boolean timedOut,
    Instant finishedAt
) {

    public RebuildJob {
        Objects.requireNonNull(projectId, "projectId");
        Objects.requireNonNull(trigger, "trigger");
        triggeringEvents = triggeringEvents == null ? List.of() : List.copyOf(triggeringEvents);
        if (trigger == RebuildTrigger.FILE_CHANGE && triggeringEvents.isEmpty()) {
            throw new IllegalArgumentException("file-change rebuild requires at least one event");
        }
    }

    public static RebuildJob queued(String projectId, RebuildTrigger trigger, List<ChangeEvent> events) {
        return new RebuildJob("job-" + UUID.randomUUID().toString().substring(0, 8), projectId, trigger,
                events, Instant.now(), null, RebuildStatus.QUEUED, null, false, null);
    }

    /**
     * Appends a further batch to this queued job. A manual trigger merged with file changes
     * stays a file-change job so the events are reported.
     */
    public RebuildJob mergedWith(List<ChangeEvent> moreEvents, RebuildTrigger moreTrigger) {
        var merged = new ArrayList<>(triggeringEvents);
        merged.addAll(moreEvents);
        RebuildTrigger combined = merged.isEmpty() ? moreTrigger : RebuildTrigger.FILE_CHANGE;
        return new RebuildJob(id, projectId, combined, merged, queuedAt, startedAt, status, error, timedOut, finishedAt);
    }

    public RebuildJob running() {
        return new RebuildJob(id, projectId, trigger, triggeringEvents, queuedAt, Instant.now(),
                RebuildStatus.RUNNING, null, false, null);
    }

    public RebuildJob succeeded() {
        return new RebuildJob(id, projectId, trigger, triggeringEvents, queuedAt, startedAt,
                RebuildStatus.SUCCEEDED, null, false, Instant.now());
    }

    public RebuildJob failed(String message, boolean timedOut) {
        return new RebuildJob(id, projectId, trigger, triggeringEvents, queuedAt, startedAt,
                RebuildStatus.FAILED, message, timedOut, Instant.now());
    }

    public RebuildJob cancelled() {
        return new RebuildJob(id, projectId, trigger, triggeringEvents, queuedAt, startedAt,
                RebuildStatus.CANCELLED, null, false, Instant.now());
    }

    /**
     * Distinct relative paths touched by the triggering events, in first-seen order.
     */
    public List<String> affectedPaths() {
        Set<String> paths = new LinkedHashSet<>();
        for (ChangeEvent event : triggeringEvents) {
            paths.add(event.relativePath());
        }
        return List.copyOf(paths);
    }
}
