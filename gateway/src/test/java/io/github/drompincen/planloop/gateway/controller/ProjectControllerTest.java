package io.github.drompincen.planloop.gateway.controller;

import io.github.drompincen.planloop.protocol.api.CreateProjectRequest;
import io.github.drompincen.planloop.protocol.api.CreateTaskRequest;
import io.github.drompincen.planloop.protocol.api.ProjectDto;
import io.github.drompincen.planloop.protocol.api.TaskDto;
import io.github.drompincen.planloop.runtime.project.ProjectService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ProjectControllerTest {

    @Mock private ProjectService projectService;

    private ProjectController controller;

    private final ProjectDto project = new ProjectDto("p1", "Website", null, ProjectDto.ProjectStatus.ACTIVE,
            "alice", Instant.now(), Instant.now());

    @BeforeEach
    void setUp() {
        controller = new ProjectController(projectService);
        when(projectService.getProject("p1")).thenReturn(Optional.of(project));
        when(projectService.getProject("missing")).thenReturn(Optional.empty());
    }

    @Test
    void createReturnsCreated() {
        CreateProjectRequest request = new CreateProjectRequest("Website", null, "alice", true);
        when(projectService.createProject(request)).thenReturn(project);

        ResponseEntity<?> response = controller.create(request);

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(response.getBody()).isEqualTo(project);
    }

    @Test
    void createWithoutNameIsBadRequest() {
        CreateProjectRequest request = new CreateProjectRequest(null, null, "alice", true);
        when(projectService.createProject(request)).thenThrow(new IllegalArgumentException("Project name is required"));

        assertThat(controller.create(request).getStatusCode().value()).isEqualTo(400);
    }

    @Test
    void taskInUnknownProjectIsNotFound() {
        ResponseEntity<?> response = controller.createTask("missing",
                new CreateTaskRequest("x", null, null, null, null, null, null));

        assertThat(response.getStatusCode().value()).isEqualTo(404);
        verify(projectService, never()).createTask(anyString(), any());
    }

    @Test
    void createTaskReturnsCreated() {
        CreateTaskRequest request = new CreateTaskRequest("Write copy", null, null, 7, null, null, "alice");
        TaskDto task = new TaskDto("t1", "p1", "Write copy", null, TaskDto.TaskStatus.TODO, 7, null, null,
                "alice", Instant.now(), Instant.now(), null);
        when(projectService.createTask("p1", request)).thenReturn(task);

        ResponseEntity<?> response = controller.createTask("p1", request);

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(response.getBody()).isEqualTo(task);
    }
}
