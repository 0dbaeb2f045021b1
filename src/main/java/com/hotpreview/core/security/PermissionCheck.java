package com.hotpreview.core.security;

import java.nio.file.Path;

/**
 * Decides whether a path may be watched or served. Consulted for the project root before
 * watching starts, for a file's directory before its changes are reported, and before a
 * file is served for the first time in a session.
 */
@FunctionalInterface
public interface PermissionCheck {

    PermissionCheck ALLOW_ALL = (path, operation) -> true;

    boolean canAccess(Path absolutePath, AccessOperation operation);
}
