package com.hotpreview.core.watch;

import com.hotpreview.core.model.PreviewException;

/**
 * The watched directory could not be opened or became unreadable.
 */
public class WatchException extends PreviewException {

    public WatchException(String message) {
        super(message);
    }

    public WatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
