package com.hotpreview.dispatch.api;

import com.hotpreview.core.config.PreviewProperties;
import com.hotpreview.core.events.BroadcastHub;
import com.hotpreview.core.events.ChannelRejectedException;
import com.hotpreview.core.events.PreviewMessage;
import com.hotpreview.core.model.PreviewSession;
import com.hotpreview.core.model.Project;
import com.hotpreview.core.registry.PreviewRegistry;
import com.hotpreview.core.registry.ProjectNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SseStreamingServiceTest {

    private BroadcastHub hub;
    private PreviewRegistry registry;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        var properties = new PreviewProperties();
        properties.getBroadcast().setMaxChannelsPerProject(2);
        hub = new BroadcastHub(properties, null);
        registry = mock(PreviewRegistry.class);
        service = new SseStreamingService(hub, registry, properties);
    }

    @AfterEach
    void tearDown() {
        service.stopHeartbeat();
        hub.shutdown();
    }

    private PreviewSession registered(String id) {
        PreviewSession session = PreviewSession.starting(Project.of(id, "Site", Path.of("/tmp/site")))
                .ready(41234, "http://localhost:41234/");
        when(registry.get(id)).thenReturn(session);
        hub.openProject(id);
        return session;
    }

    @Test
    @DisplayName("project emitter subscribes a channel bound to the project")
    void projectEmitter() {
        registered("site");

        SseEmitter emitter = service.createProjectEmitter("site");

        assertNotNull(emitter);
        assertEquals(1, hub.channelCount("site"));
        assertEquals(1, service.activeEmitterCount());
    }

    @Test
    @DisplayName("unknown project is rejected before any channel opens")
    void unknownProject() {
        when(registry.get("ghost")).thenReturn(null);

        assertThrows(ProjectNotFoundException.class, () -> service.createProjectEmitter("ghost"));
        assertEquals(0, hub.channelCount());
        assertEquals(0, service.activeEmitterCount());
    }

    @Test
    @DisplayName("a project unregistered after lookup is reported as not found")
    void projectRemovedBeforeSubscribe() {
        registered("site");
        hub.closeProject("site", PreviewMessage.projectRemoved("site"));

        assertThrows(ProjectNotFoundException.class, () -> service.createProjectEmitter("site"));
        assertEquals(0, hub.channelCount());
        assertEquals(0, service.activeEmitterCount());
    }

    @Test
    @DisplayName("channel limit surfaces as ChannelRejectedException")
    void channelLimit() {
        registered("site");
        service.createProjectEmitter("site");
        service.createProjectEmitter("site");

        assertThrows(ChannelRejectedException.class, () -> service.createProjectEmitter("site"));
        assertEquals(2, service.activeEmitterCount());
    }

    @Test
    @DisplayName("global emitter subscribes a catalogue channel")
    void globalEmitter() {
        when(registry.list()).thenReturn(List.of());

        service.createGlobalEmitter();

        assertEquals(1, hub.channelCount(null));
    }

    @Test
    @DisplayName("sending to a completed emitter is reported as an IOException")
    void sinkAfterComplete() {
        var emitter = new SseEmitter(0L);
        var sink = new SseStreamingService.EmitterSink(emitter);
        sink.close();

        assertThrows(IOException.class, () -> sink.send(PreviewMessage.projectRemoved("site")));
    }
}
