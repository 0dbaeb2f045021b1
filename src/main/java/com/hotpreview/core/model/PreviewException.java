package com.hotpreview.core.model;

/**
 * Base type for all preview failures. Subclasses map onto the error taxonomy the
 * registry and REST layer react to.
 */
public class PreviewException extends RuntimeException {

    public PreviewException(String message) {
        super(message);
    }

    public PreviewException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the caller may retry the same operation unchanged and reasonably expect success.
     */
    public boolean isRetryable() {
        return false;
    }
}
