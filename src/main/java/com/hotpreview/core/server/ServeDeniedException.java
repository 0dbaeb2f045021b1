package com.hotpreview.core.server;

import com.hotpreview.core.model.PreviewException;

/**
 * A request resolved outside the project root or was refused by the permission check.
 * Answered with 403; never changes session status.
 */
public class ServeDeniedException extends PreviewException {

    public enum Reason { TRAVERSAL, PERMISSION }

    private final Reason reason;

    public ServeDeniedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
