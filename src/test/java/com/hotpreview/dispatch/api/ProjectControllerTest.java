package com.hotpreview.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hotpreview.core.model.PreviewSession;
import com.hotpreview.core.model.Project;
import com.hotpreview.core.registry.PreviewRegistry;
import com.hotpreview.core.registry.ProjectConfigurationException;
import com.hotpreview.core.registry.ProjectNotFoundException;
import com.hotpreview.core.server.PortUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.file.Path;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ProjectController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ProjectControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private PreviewRegistry registry;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private static PreviewSession readySession(String id) {
        return PreviewSession.starting(Project.of(id, "Site", Path.of("/tmp/site")))
                .ready(41234, "http://localhost:41234/");
    }

    // ── POST /api/v1/projects ────────────────────────────────────────

    @Test
    @DisplayName("POST /projects registers and returns the preview URL")
    void registerProject() throws Exception {
        when(registry.register(any(Project.class))).thenReturn(readySession("site"));

        String body = objectMapper.writeValueAsString(new ProjectRequest("site", "Site", "/tmp/site",
                List.of(new ProjectRequest.ProxyRuleRequest("/api", "http://localhost:3000")),
                new ProjectRequest.CompileStepRequest("npx tsc", null, 20)));

        mockMvc.perform(post("/api/v1/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("site"))
                .andExpect(jsonPath("$.previewUrl").value("http://localhost:41234/"))
                .andExpect(jsonPath("$.port").value(41234))
                .andExpect(jsonPath("$.status").value("ready"))
                .andExpect(jsonPath("$.lastError").doesNotExist());

        var captor = ArgumentCaptor.forClass(Project.class);
        verify(registry).register(captor.capture());
        Project project = captor.getValue();
        assertEquals("/api", project.proxyRules().get(0).matchPrefix());
        assertEquals(20, project.compileStep().timeoutSeconds());
    }

    @Test
    @DisplayName("POST /projects without rootPath returns 400")
    void registerWithoutRoot() throws Exception {
        mockMvc.perform(post("/api/v1/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"site\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.message").value(containsString("rootPath")))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    @DisplayName("POST /projects with a relative rootPath returns 400")
    void registerRelativeRoot() throws Exception {
        mockMvc.perform(post("/api/v1/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rootPath\":\"site\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /projects with an unusable root returns 400")
    void registerBadRoot() throws Exception {
        when(registry.register(any(Project.class)))
                .thenThrow(new ProjectConfigurationException("Project root is not a directory: /tmp/site"));

        mockMvc.perform(post("/api/v1/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rootPath\":\"/tmp/site\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("not a directory")));
    }

    @Test
    @DisplayName("POST /projects when no port can be bound returns retryable 503")
    void registerPortUnavailable() throws Exception {
        when(registry.register(any(Project.class)))
                .thenThrow(new PortUnavailableException("Cannot bind", new java.io.IOException("in use")));

        mockMvc.perform(post("/api/v1/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rootPath\":\"/tmp/site\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "1"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    // ── GET /api/v1/projects ─────────────────────────────────────────

    @Test
    @DisplayName("GET /projects lists sessions")
    void listProjects() throws Exception {
        when(registry.list()).thenReturn(List.of(readySession("a"), readySession("b")));

        mockMvc.perform(get("/api/v1/projects"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].id").value("a"))
                .andExpect(jsonPath("$[1].status").value("ready"));
    }

    @Test
    @DisplayName("GET /projects/{id} returns 404 for unknown project")
    void getUnknown() throws Exception {
        when(registry.get("ghost")).thenReturn(null);

        mockMvc.perform(get("/api/v1/projects/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /projects/{id} returns the session")
    void getProject() throws Exception {
        when(registry.get("site")).thenReturn(readySession("site").error("root deleted"));

        mockMvc.perform(get("/api/v1/projects/site"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.lastError").value("root deleted"));
    }

    // ── DELETE / rebuild ─────────────────────────────────────────────

    @Test
    @DisplayName("DELETE /projects/{id} returns 204")
    void unregister() throws Exception {
        when(registry.unregister("site")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/projects/site"))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("DELETE /projects/{id} returns 404 when not registered")
    void unregisterUnknown() throws Exception {
        when(registry.unregister("ghost")).thenReturn(false);

        mockMvc.perform(delete("/api/v1/projects/ghost"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /projects/{id}/rebuild returns 202")
    void rebuild() throws Exception {
        mockMvc.perform(post("/api/v1/projects/site/rebuild"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.projectId").value("site"))
                .andExpect(jsonPath("$.trigger").value("manual"));
        verify(registry).rebuild("site");
    }

    @Test
    @DisplayName("POST /projects/{id}/rebuild returns 404 for unknown project")
    void rebuildUnknown() throws Exception {
        doThrow(new ProjectNotFoundException("ghost")).when(registry).rebuild("ghost");

        mockMvc.perform(post("/api/v1/projects/ghost/rebuild"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Project not registered: ghost"));
    }

    // ── SSE ──────────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /projects/{id}/events opens an event stream")
    void projectEvents() throws Exception {
        when(sseStreamingService.createProjectEmitter("site")).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/api/v1/projects/site/events").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isOk())
                .andExpect(request().asyncStarted());
    }

    @Test
    @DisplayName("GET /events opens the catalogue stream")
    void catalogueEvents() throws Exception {
        when(sseStreamingService.createGlobalEmitter()).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/api/v1/events").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isOk())
                .andExpect(request().asyncStarted());
    }
}
