package com.hotpreview.dispatch.api;

import com.hotpreview.core.model.CompileStep;
import com.hotpreview.core.model.Project;
import com.hotpreview.core.model.ProxyRule;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/projects.
 *
 * @param id          project id; nullable, generated when absent
 * @param name        display name; nullable, defaults to the id
 * @param rootPath    absolute path of the project directory
 * @param proxyRules  ordered proxy rules; nullable
 * @param compileStep compile step run on every rebuild; nullable
 */
public record ProjectRequest(
    String id,
    String name,
    String rootPath,
    List<ProxyRuleRequest> proxyRules,
    CompileStepRequest compileStep
) {

    public record ProxyRuleRequest(String matchPrefix, String targetUrl) {}

    /**
     * @param timeoutSeconds nullable; the configured default applies when absent
     */
    public record CompileStepRequest(String command, String workingDir, Integer timeoutSeconds) {}

    /**
     * @throws IllegalArgumentException when a required field is missing or malformed
     */
    public Project toProject() {
        if (rootPath == null || rootPath.isBlank()) {
            throw new IllegalArgumentException("rootPath is required");
        }
        Path root;
        try {
            root = Path.of(rootPath);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid rootPath: " + rootPath);
        }
        if (!root.isAbsolute()) {
            throw new IllegalArgumentException("rootPath must be absolute: " + rootPath);
        }

        List<ProxyRule> rules = proxyRules == null ? List.of() : proxyRules.stream()
                .map(r -> {
                    if (r.matchPrefix() == null || r.targetUrl() == null || r.targetUrl().isBlank()) {
                        throw new IllegalArgumentException("Proxy rules need matchPrefix and targetUrl");
                    }
                    return new ProxyRule(r.matchPrefix(), r.targetUrl());
                })
                .toList();

        CompileStep step = null;
        if (compileStep != null) {
            if (compileStep.command() == null || compileStep.command().isBlank()) {
                throw new IllegalArgumentException("compileStep.command is required");
            }
            step = new CompileStep(compileStep.command(),
                    compileStep.workingDir() == null ? null : Path.of(compileStep.workingDir()),
                    compileStep.timeoutSeconds() == null ? 0 : compileStep.timeoutSeconds());
        }

        String projectId = (id == null || id.isBlank()) ? Project.generateId() : id.trim();
        return new Project(projectId, name, root, rules, step, Instant.now());
    }
}
