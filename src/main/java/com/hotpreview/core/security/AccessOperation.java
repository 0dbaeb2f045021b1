package com.hotpreview.core.security;

public enum AccessOperation {
    WATCH,
    SERVE
}
