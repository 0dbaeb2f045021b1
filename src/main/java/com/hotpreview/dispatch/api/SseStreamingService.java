package com.hotpreview.dispatch.api;

import com.hotpreview.core.config.PreviewProperties;
import com.hotpreview.core.events.BroadcastHub;
import com.hotpreview.core.events.ChannelHandle;
import com.hotpreview.core.events.ChannelRejectedException;
import com.hotpreview.core.events.ChannelSink;
import com.hotpreview.core.events.PreviewMessage;
import com.hotpreview.core.model.PreviewSession;
import com.hotpreview.core.registry.PreviewRegistry;
import com.hotpreview.core.registry.ProjectNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Opens {@link BroadcastHub} channels backed by {@link SseEmitter}s.
 * <p>
 * Each emitter is one channel: bound to a project (greeted with {@code project-state}) or
 * global (greeted with {@code projects-list}). Every SSE frame is named after the message
 * type and carries the JSON message as data. Emitter completion, timeout or error
 * unsubscribes the channel; closing the channel from the hub completes the emitter.
 * <p>
 * Heartbeats are sent as SSE comments to keep idle connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private final BroadcastHub broadcastHub;
    private final PreviewRegistry registry;
    private final long timeoutMs;
    private final long heartbeatSeconds;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    public SseStreamingService(BroadcastHub broadcastHub, PreviewRegistry registry, PreviewProperties properties) {
        this.broadcastHub = broadcastHub;
        this.registry = registry;
        this.timeoutMs = properties.getBroadcast().getSseTimeoutMs();
        this.heartbeatSeconds = properties.getBroadcast().getHeartbeatSeconds();
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats, heartbeatSeconds, heartbeatSeconds,
                TimeUnit.SECONDS);
        log.info("SSE heartbeat scheduler started (interval={}s)", heartbeatSeconds);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Opens a channel bound to one project.
     *
     * @throws ProjectNotFoundException if the project is not registered
     * @throws ChannelRejectedException if the project's channel limit is reached
     */
    public SseEmitter createProjectEmitter(String projectId) {
        PreviewSession session = registry.get(projectId);
        if (session == null) {
            throw new ProjectNotFoundException(projectId);
        }
        return open(projectId, PreviewMessage.projectState(session));
    }

    /**
     * Opens a global catalogue channel.
     */
    public SseEmitter createGlobalEmitter() {
        return open(null, PreviewMessage.projectsList(registry.list()));
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private SseEmitter open(String projectId, PreviewMessage greeting) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        String channelId = "sse-" + UUID.randomUUID();
        String scope = projectId == null ? "catalogue" : "project " + projectId;

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for {}: {}", scope, e.getMessage());
        }

        ChannelHandle handle;
        try {
            handle = broadcastHub.subscribe(channelId, projectId, new EmitterSink(emitter), greeting);
        } catch (ChannelRejectedException e) {
            if (projectId != null && e.reason() == ChannelRejectedException.Reason.PROJECT_NOT_REGISTERED) {
                // unregistered after the snapshot was taken
                throw new ProjectNotFoundException(projectId);
            }
            throw e;
        }
        var registration = new EmitterRegistration(scope, emitter, handle);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE channel {} timed out ({})", channelId, scope);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE channel {} error ({}): {}", channelId, scope, ex.getMessage());
            cleanup(registration);
        });

        log.info("SSE channel {} opened for {} (timeout={}ms)", channelId, scope, timeoutMs);
        return emitter;
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // the emitter's own callbacks unsubscribe it
                log.debug("Heartbeat skipped for {}: {}", registration.scope, e.getMessage());
            }
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (activeRegistrations.remove(registration)) {
            broadcastHub.unsubscribe(registration.handle);
            log.debug("SSE channel {} closed ({})", registration.handle.channelId(), registration.scope);
        }
    }

    private record EmitterRegistration(String scope, SseEmitter emitter, ChannelHandle handle) {}

    /** Hub-side end of an SSE channel. */
    static final class EmitterSink implements ChannelSink {
        private final SseEmitter emitter;

        EmitterSink(SseEmitter emitter) {
            this.emitter = emitter;
        }

        @Override
        public void send(PreviewMessage message) throws IOException {
            try {
                emitter.send(SseEmitter.event()
                        .name(message.type().wireName())
                        .data(message.toWire()));
            } catch (IllegalStateException e) {
                throw new IOException("Emitter already completed", e);
            }
        }

        @Override
        public void close() {
            emitter.complete();
        }
    }
}
