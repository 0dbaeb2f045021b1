package com.hotpreview.core.model;

public enum ChangeKind {
    ADDED("added"),
    MODIFIED("modified"),
    REMOVED("removed");

    private final String wireName;

    ChangeKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Folds a later observation of the same path into an earlier one that has not been emitted yet.
     *
     * @return the combined kind, or {@code null} when the two cancel out (created then deleted)
     */
    public ChangeKind followedBy(ChangeKind next) {
        if (this == ADDED && next == MODIFIED) {
            return ADDED;
        }
        if (this == ADDED && next == REMOVED) {
            return null;
        }
        if (this == REMOVED && next == ADDED) {
            return MODIFIED;
        }
        return next;
    }
}
