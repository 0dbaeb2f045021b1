package com.hotpreview.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for preview sessions.
 */
@Service
public class PreviewMetrics {

    private final MeterRegistry registry;

    public PreviewMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRebuild(String status, Duration duration) {
        Timer.builder("hotpreview.rebuild.duration")
                .tag("status", status)
                .register(registry)
                .record(duration);
    }

    public void recordWatchEvent(String kind) {
        Counter.builder("hotpreview.watch.events")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordWatchError() {
        Counter.builder("hotpreview.watch.errors")
                .description("Watchers stopped because their directory became unreadable")
                .register(registry)
                .increment();
    }

    /**
     * Records a message dropped from a full channel mailbox.
     *
     * @param scope "project" or "global"
     */
    public void recordBroadcastDrop(String scope) {
        Counter.builder("hotpreview.broadcast.dropped")
                .description("Messages evicted from full channel mailboxes")
                .tag("scope", scope)
                .register(registry)
                .increment();
    }

    /**
     * @param reason "traversal" or "permission"
     */
    public void recordServeDenied(String reason) {
        Counter.builder("hotpreview.serve.denied")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param result "created", "existing" or "failed"
     */
    public void recordRegistration(String result) {
        Counter.builder("hotpreview.registrations.total")
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
