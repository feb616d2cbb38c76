package io.github.drompincen.planloop.gateway.controller;

import io.github.drompincen.planloop.protocol.api.CreateProjectRequest;
import io.github.drompincen.planloop.protocol.api.CreateTaskRequest;
import io.github.drompincen.planloop.protocol.api.ProjectDto;
import io.github.drompincen.planloop.protocol.api.TaskDto;
import io.github.drompincen.planloop.runtime.project.ProjectService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private final ProjectService projectService;

    public ProjectController(ProjectService projectService) {
        this.projectService = projectService;
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody CreateProjectRequest request) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(projectService.createProject(request));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping
    public List<ProjectDto> list(@RequestParam(required = false) String ownerId) {
        return projectService.listProjects(ownerId);
    }

    @GetMapping("/{projectId}")
    public ResponseEntity<ProjectDto> get(@PathVariable String projectId) {
        return projectService.getProject(projectId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{projectId}/tasks")
    public ResponseEntity<?> createTask(@PathVariable String projectId, @RequestBody CreateTaskRequest request) {
        if (projectService.getProject(projectId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(projectService.createTask(projectId, request));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/{projectId}/tasks")
    public List<TaskDto> listTasks(@PathVariable String projectId) {
        return projectService.listTasks(projectId);
    }
}
