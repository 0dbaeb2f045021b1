package com.hotpreview.core.scheduler;

import com.hotpreview.core.model.PreviewException;

/**
 * A compile step exited non-zero, could not be started, or ran past its timeout.
 */
public class BuildException extends PreviewException {

    private final boolean timedOut;

    public BuildException(String message, boolean timedOut) {
        super(message);
        this.timedOut = timedOut;
    }

    public BuildException(String message, Throwable cause) {
        super(message, cause);
        this.timedOut = false;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
