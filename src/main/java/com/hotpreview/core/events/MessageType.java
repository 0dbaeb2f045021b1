package com.hotpreview.core.events;

/**
 * The fixed set of messages pushed to client channels.
 * <p>
 * Catalogue messages describe the set of projects and are the only ones global
 * subscribers ever see; the rest are scoped to one project.
 */
public enum MessageType {
    PROJECT_ADDED("project-added", true),
    PROJECT_REMOVED("project-removed", true),
    PROJECTS_LIST("projects-list", true),
    PROJECT_STATE("project-state", false),
    FILE_CHANGE("file-change", false),
    REBUILD_STARTED("rebuild-started", false),
    REBUILD_COMPLETE("rebuild-complete", false),
    REBUILD_ERROR("rebuild-error", false),
    WATCHER_ERROR("watcher-error", false);

    private final String wireName;
    private final boolean catalogue;

    MessageType(String wireName, boolean catalogue) {
        this.wireName = wireName;
        this.catalogue = catalogue;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isCatalogue() {
        return catalogue;
    }
}
