package com.hotpreview.core.scheduler;

import com.hotpreview.core.model.RebuildJob;

/**
 * The work a rebuild performs for a project. Returning normally means success.
 */
@FunctionalInterface
public interface RebuildStep {

    /** Projects without a compile step rebuild instantly. */
    RebuildStep NOOP = (job, cancellation) -> { };

    /**
     * @throws BuildException when the build fails or times out
     */
    void execute(RebuildJob job, Cancellation cancellation);
}
