package com.hotpreview.core.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Default {@link PermissionCheck} backed by {@link SecurityProperties}: blocked roots always lose,
 * and when allowed roots are configured a path must sit under one of them.
 * <p>
 * Replace this bean to plug in an external policy layer.
 */
@Service
public class PathRestrictionService implements PermissionCheck {

    private static final Logger log = LoggerFactory.getLogger(PathRestrictionService.class);

    private final SecurityProperties securityProperties;

    public PathRestrictionService(SecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    @Override
    public boolean canAccess(Path absolutePath, AccessOperation operation) {
        Path path = absolutePath.toAbsolutePath().normalize();
        if (isUnderAny(securityProperties.getBlockedRoots(), path)) {
            log.debug("Denied {} of {}: under a blocked root", operation, path);
            return false;
        }
        List<String> allowed = securityProperties.getAllowedRoots();
        if (allowed == null || allowed.isEmpty()) {
            return true;
        }
        boolean permitted = isUnderAny(allowed, path);
        if (!permitted) {
            log.debug("Denied {} of {}: outside allowed roots", operation, path);
        }
        return permitted;
    }

    private boolean isUnderAny(List<String> roots, Path path) {
        if (roots == null || roots.isEmpty()) {
            return false;
        }
        for (String root : roots) {
            if (path.startsWith(Paths.get(root).toAbsolutePath().normalize())) {
                return true;
            }
        }
        return false;
    }
}
