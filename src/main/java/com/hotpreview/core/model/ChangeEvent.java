package com.hotpreview.core.model;

import java.time.Instant;

/**
 * A single coalesced filesystem change inside a project.
 *
 * @param projectId    owning project
 * @param relativePath path relative to the project root, always with {@code /} separators
 * @param kind         what happened to the path
 * @param observedAt   when the watcher emitted the event
 */
public record ChangeEvent(
    String projectId,
    String relativePath,
    ChangeKind kind,
    Instant observedAt
) {}
