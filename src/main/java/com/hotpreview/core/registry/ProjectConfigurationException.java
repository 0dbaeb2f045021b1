package com.hotpreview.core.registry;

import com.hotpreview.core.model.PreviewException;

/**
 * The project descriptor cannot be used: root missing, unreadable, not permitted, or
 * conflicting with an existing registration. Registration fails and no session is created.
 */
public class ProjectConfigurationException extends PreviewException {

    public ProjectConfigurationException(String message) {
        super(message);
    }

    public ProjectConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
