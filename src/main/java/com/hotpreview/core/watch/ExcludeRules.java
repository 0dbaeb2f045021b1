package com.hotpreview.core.watch;

import com.hotpreview.core.config.PreviewProperties;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Decides which project paths never produce change events: dependency and build output
 * directories, version-control metadata, dotfiles, and temp/swap/log files.
 */
public final class ExcludeRules {

    private final Set<String> directories;
    private final List<String> suffixes;
    private final boolean ignoreDotfiles;

    public ExcludeRules(Set<String> directories, List<String> suffixes, boolean ignoreDotfiles) {
        this.directories = Set.copyOf(directories);
        this.suffixes = List.copyOf(suffixes);
        this.ignoreDotfiles = ignoreDotfiles;
    }

    public static ExcludeRules from(PreviewProperties.Watch watch) {
        return new ExcludeRules(Set.copyOf(watch.getExcludeDirectories()), watch.getExcludeSuffixes(),
                watch.isIgnoreDotfiles());
    }

    public static ExcludeRules defaults() {
        return from(new PreviewProperties.Watch());
    }

    /**
     * @param relativePath path relative to the project root; the empty path (the root itself) is never excluded
     */
    public boolean isExcluded(Path relativePath) {
        int count = relativePath.getNameCount();
        for (int i = 0; i < count; i++) {
            String name = relativePath.getName(i).toString();
            if (name.isEmpty()) {
                continue;
            }
            if (directories.contains(name)) {
                return true;
            }
            if (ignoreDotfiles && name.startsWith(".")) {
                return true;
            }
        }
        Path fileName = relativePath.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        for (String suffix : suffixes) {
            if (name.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }
}
