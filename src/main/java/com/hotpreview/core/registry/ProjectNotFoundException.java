package com.hotpreview.core.registry;

import com.hotpreview.core.model.PreviewException;

public class ProjectNotFoundException extends PreviewException {

    public ProjectNotFoundException(String projectId) {
        super("Project not registered: " + projectId);
    }
}
