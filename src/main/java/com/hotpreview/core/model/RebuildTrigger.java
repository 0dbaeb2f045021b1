package com.hotpreview.core.model;

public enum RebuildTrigger {
    FILE_CHANGE("file-change"),
    MANUAL("manual");

    private final String wireName;

    RebuildTrigger(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
