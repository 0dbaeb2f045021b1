package com.hotpreview.core.model;

public enum SessionStatus {
    STARTING("starting"),
    READY("ready"),
    ERROR("error"),
    STOPPED("stopped");

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
