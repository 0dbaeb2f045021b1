package com.hotpreview.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Descriptor of a project registered for preview.
 * <p>
 * Immutable; proxy rules and the compile step are replaced through re-registration,
 * which produces a new instance via {@link #withSettingsFrom(Project)}.
 *
 * @param id           unique project id
 * @param name         display name
 * @param rootPath     absolute, normalized root directory
 * @param proxyRules   ordered proxy rules, first match wins
 * @param compileStep  optional compile step ({@code null} when the project has none)
 * @param registeredAt when the project was first registered
 */
public record Project(
    String id,
    String name,
    Path rootPath,
    List<ProxyRule> proxyRules,
    CompileStep compileStep,
    Instant registeredAt
) {

    public Project {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(rootPath, "rootPath");
        name = (name == null || name.isBlank()) ? id : name;
        rootPath = rootPath.toAbsolutePath().normalize();
        proxyRules = proxyRules == null ? List.of() : List.copyOf(proxyRules);
        registeredAt = registeredAt == null ? Instant.now() : registeredAt;
    }

    public static Project of(String id, String name, Path rootPath) {
        return new Project(id, name, rootPath, List.of(), null, Instant.now());
    }

    public static String generateId() {
        return "prj-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public Optional<CompileStep> compileStepOpt() {
        return Optional.ofNullable(compileStep);
    }

    /**
     * Keeps identity, root and registration time; takes proxy rules and compile step from {@code update}.
     */
    public Project withSettingsFrom(Project update) {
        return new Project(id, name, rootPath, update.proxyRules(), update.compileStep(), registeredAt);
    }
}
