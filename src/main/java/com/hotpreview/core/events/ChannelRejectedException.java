package com.hotpreview.core.events;

import com.hotpreview.core.model.PreviewException;

/**
 * Thrown when a channel cannot be opened: unknown project, per-project channel limit reached,
 * or a channel id already in use.
 */
public class ChannelRejectedException extends PreviewException {

    public enum Reason { PROJECT_NOT_REGISTERED, LIMIT_REACHED, DUPLICATE_ID }

    private final Reason reason;

    public ChannelRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
