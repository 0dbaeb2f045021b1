package com.hotpreview.dispatch.api;

import com.hotpreview.core.model.PreviewSession;
import com.hotpreview.core.model.Project;
import com.hotpreview.core.registry.PreviewRegistry;
import com.hotpreview.core.registry.ProjectNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST controller for project registration and preview channels.
 */
@RestController
@RequestMapping("/api/v1")
public class ProjectController {

    private static final Logger log = LoggerFactory.getLogger(ProjectController.class);

    private final PreviewRegistry registry;
    private final SseStreamingService sseStreamingService;

    public ProjectController(PreviewRegistry registry, SseStreamingService sseStreamingService) {
        this.registry = registry;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/projects: register a project, or return its live session if the id is taken.
     */
    @PostMapping("/projects")
    public ResponseEntity<ProjectResponse> register(@RequestBody ProjectRequest request) {
        Project project = request.toProject();
        log.info("Registering project {} at {}", project.id(), project.rootPath());
        PreviewSession session = registry.register(project);
        return ResponseEntity.ok(ProjectResponse.from(session));
    }

    @GetMapping("/projects")
    public List<ProjectSummary> list() {
        return registry.list().stream().map(ProjectSummary::from).toList();
    }

    @GetMapping("/projects/{id}")
    public ProjectResponse get(@PathVariable String id) {
        PreviewSession session = registry.get(id);
        if (session == null) {
            throw new ProjectNotFoundException(id);
        }
        return ProjectResponse.from(session);
    }

    @DeleteMapping("/projects/{id}")
    public ResponseEntity<Void> unregister(@PathVariable String id) {
        if (!registry.unregister(id)) {
            throw new ProjectNotFoundException(id);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/projects/{id}/rebuild: queue a manual rebuild.
     */
    @PostMapping("/projects/{id}/rebuild")
    public ResponseEntity<Map<String, String>> rebuild(@PathVariable String id) {
        registry.rebuild(id);
        return ResponseEntity.accepted().body(Map.of("projectId", id, "trigger", "manual"));
    }

    @GetMapping(value = "/projects/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter projectEvents(@PathVariable String id) {
        return sseStreamingService.createProjectEmitter(id);
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter catalogueEvents() {
        return sseStreamingService.createGlobalEmitter();
    }
}
