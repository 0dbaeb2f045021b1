package com.hotpreview.core.server;

import com.hotpreview.core.config.PreviewProperties;
import com.hotpreview.core.metrics.PreviewMetrics;
import com.hotpreview.core.security.PermissionCheck;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Creates unstarted {@link ProjectServer}s sharing one proxy client.
 */
@Component
public class ProjectServerFactory {

    private final PreviewProperties.Server config;
    private final PermissionCheck permissionCheck;
    private final PreviewMetrics metrics;
    private final ProxyForwarder proxyForwarder;

    @Autowired
    public ProjectServerFactory(PreviewProperties properties, PermissionCheck permissionCheck,
                                @Autowired(required = false) PreviewMetrics metrics) {
        this.config = properties.getServer();
        this.permissionCheck = permissionCheck;
        this.metrics = metrics;
        this.proxyForwarder = ProxyForwarder.create(config.getProxyConnectTimeoutMs(), config.getProxyRequestTimeoutMs());
    }

    public ProjectServer create() {
        return new ProjectServer(config.getHost(), config.getEntryDocument(), permissionCheck, proxyForwarder, metrics);
    }
}
