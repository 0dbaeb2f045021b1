package com.hotpreview.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * External command run on every rebuild, e.g. {@code npx tsc}.
 *
 * @param command        shell command line
 * @param workingDir     directory to run in; {@code null} means the project root
 * @param timeoutSeconds per-step timeout; {@code 0} means the configured default
 */
public record CompileStep(String command, Path workingDir, int timeoutSeconds) {

    public CompileStep {
        Objects.requireNonNull(command, "command");
        if (command.isBlank()) {
            throw new IllegalArgumentException("compile command must not be blank");
        }
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("timeoutSeconds must be >= 0");
        }
    }

    public CompileStep(String command) {
        this(command, null, 0);
    }

    public Path resolveWorkingDir(Path projectRoot) {
        if (workingDir == null) {
            return projectRoot;
        }
        return workingDir.isAbsolute() ? workingDir : projectRoot.resolve(workingDir).normalize();
    }
}
