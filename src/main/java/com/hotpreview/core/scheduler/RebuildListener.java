package com.hotpreview.core.scheduler;

import com.hotpreview.core.model.RebuildJob;
import com.hotpreview.core.model.RebuildOutcome;

/**
 * Receives a project's rebuild lifecycle. Both callbacks run on the rebuild worker, in job order.
 */
public interface RebuildListener {

    void onStarted(RebuildJob job);

    /**
     * Called exactly once per job that succeeded or failed. Cancelled jobs are not reported.
     */
    void onCompleted(RebuildOutcome outcome);
}
