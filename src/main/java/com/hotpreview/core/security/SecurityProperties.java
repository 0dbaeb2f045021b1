package com.hotpreview.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConfigurationProperties(prefix = "hotpreview.security")
public class SecurityProperties {

    /** When non-empty, only paths under one of these roots are accessible. */
    private List<String> allowedRoots = List.of();

    /** Paths under these roots are never accessible, even inside an allowed root. */
    private List<String> blockedRoots = List.of(
            "/etc", "/bin", "/sbin", "/usr/bin", "/usr/sbin", "/var/log", "/var/run", "/proc", "/sys");

    public List<String> getAllowedRoots() {
        return allowedRoots;
    }

    public void setAllowedRoots(List<String> allowedRoots) {
        this.allowedRoots = allowedRoots;
    }

    public List<String> getBlockedRoots() {
        return blockedRoots;
    }

    public void setBlockedRoots(List<String> blockedRoots) {
        this.blockedRoots = blockedRoots;
    }
}
