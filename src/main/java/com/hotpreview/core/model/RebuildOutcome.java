package com.hotpreview.core.model;

import java.time.Duration;

/**
 * Reported exactly once per finished job.
 */
public record RebuildOutcome(String projectId, RebuildJob job, Duration duration) {

    public boolean succeeded() {
        return job.status() == RebuildStatus.SUCCEEDED;
    }
}
