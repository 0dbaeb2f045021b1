package com.hotpreview.core.server;

import com.hotpreview.core.model.PreviewException;

/**
 * No listening port could be acquired for a project. Retryable: ports free up.
 */
public class PortUnavailableException extends PreviewException {

    public PortUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
