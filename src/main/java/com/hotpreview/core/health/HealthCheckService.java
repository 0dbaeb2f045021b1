package com.hotpreview.core.health;

import com.hotpreview.core.events.BroadcastHub;
import com.hotpreview.core.model.PreviewSession;
import com.hotpreview.core.model.SessionStatus;
import com.hotpreview.core.registry.PreviewRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final PreviewRegistry registry;
    private final BroadcastHub broadcastHub;

    public HealthCheckService(
            @Autowired(required = false) PreviewRegistry registry,
            @Autowired(required = false) BroadcastHub broadcastHub) {
        this.registry = registry;
        this.broadcastHub = broadcastHub;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkRegistry());
        results.add(checkBroadcast());
        return results;
    }

    private HealthStatus checkRegistry() {
        if (registry == null) {
            return HealthStatus.unavailable("registry", "Preview registry not available");
        }
        List<PreviewSession> sessions = registry.list();
        List<String> failing = sessions.stream()
                .filter(s -> s.status() == SessionStatus.ERROR)
                .map(PreviewSession::projectId)
                .toList();
        Map<String, String> metadata = Map.of("sessions", String.valueOf(sessions.size()));
        if (!failing.isEmpty()) {
            return new HealthStatus("registry", HealthStatus.Status.DEGRADED,
                    "Watcher stopped for " + String.join(", ", failing), metadata);
        }
        return new HealthStatus("registry", HealthStatus.Status.UP,
                sessions.size() + " preview session(s) active", metadata);
    }

    private HealthStatus checkBroadcast() {
        if (broadcastHub == null) {
            return HealthStatus.unavailable("broadcast", "Broadcast hub not available");
        }
        int channels = broadcastHub.channelCount();
        return new HealthStatus("broadcast", HealthStatus.Status.UP,
                channels + " channel(s) open", Map.of("channels", String.valueOf(channels)));
    }
}
