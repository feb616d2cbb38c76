package io.github.drompincen.planloop.runtime.project;

import io.github.drompincen.planloop.persistence.document.ProjectDocument;
import io.github.drompincen.planloop.persistence.document.TaskDocument;
import io.github.drompincen.planloop.persistence.repository.ProjectRepository;
import io.github.drompincen.planloop.persistence.repository.TaskRepository;
import io.github.drompincen.planloop.protocol.api.CreateProjectRequest;
import io.github.drompincen.planloop.protocol.api.CreateTaskRequest;
import io.github.drompincen.planloop.protocol.api.ProjectDto;
import io.github.drompincen.planloop.protocol.api.TaskDto;
import io.github.drompincen.planloop.protocol.api.TaskPriority;
import io.github.drompincen.planloop.runtime.planning.PlanTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Minimal project and task bookkeeping feeding the planning and scheduling engines.
 */
@Service
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;
    private final PlanTrigger planTrigger;
    private final Clock clock;

    public ProjectService(ProjectRepository projectRepository, TaskRepository taskRepository,
                          PlanTrigger planTrigger, Clock clock) {
        this.projectRepository = projectRepository;
        this.taskRepository = taskRepository;
        this.planTrigger = planTrigger;
        this.clock = clock;
    }

    public ProjectDto createProject(CreateProjectRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("Project name is required");
        }
        ProjectDocument saved = insertProject(request.name().trim(), request.description(), request.ownerId());
        planTrigger.onProjectCreated(saved.getProjectId(), saved.getOwnerId(), !Boolean.FALSE.equals(request.autoPlan()));
        return ProjectMapper.toDto(saved);
    }

    /** Stores an ACTIVE project without touching plan generation. */
    public ProjectDocument insertProject(String name, String description, String ownerId) {
        Instant now = clock.instant();
        ProjectDocument doc = new ProjectDocument();
        doc.setProjectId(UUID.randomUUID().toString());
        doc.setName(name);
        doc.setDescription(description);
        doc.setStatus(ProjectDto.ProjectStatus.ACTIVE);
        doc.setOwnerId(ownerId);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        ProjectDocument saved = projectRepository.insert(doc);
        log.info("Created project {}: {}", saved.getProjectId(), name);
        return saved;
    }

    public Optional<ProjectDto> getProject(String projectId) {
        return projectRepository.findById(projectId).map(ProjectMapper::toDto);
    }

    public List<ProjectDto> listProjects(String ownerId) {
        List<ProjectDocument> docs = ownerId != null
                ? projectRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId)
                : projectRepository.findAll();
        return docs.stream().map(ProjectMapper::toDto).toList();
    }

    /** @throws IllegalArgumentException if the project does not exist or the title is missing */
    public TaskDto createTask(String projectId, CreateTaskRequest request) {
        if (!projectRepository.existsById(projectId)) {
            throw new IllegalArgumentException("Project not found: " + projectId);
        }
        if (request == null || request.title() == null || request.title().isBlank()) {
            throw new IllegalArgumentException("Task title is required");
        }
        int priority = request.priority() != null
                ? TaskPriority.clamp(request.priority())
                : TaskPriority.MEDIUM.representativeValue();
        TaskDocument doc = newTask(projectId, request.title().trim(), request.description(),
                request.status() != null ? request.status() : TaskDto.TaskStatus.TODO,
                priority, request.assigneeId());
        doc.setEstimatedHours(request.estimatedHours());
        doc.setDueDate(request.dueDate());
        return ProjectMapper.toDto(save(doc));
    }

    public TaskDocument insertTask(String projectId, String title, String description,
                                   TaskDto.TaskStatus status, int priority, String assigneeId) {
        return save(newTask(projectId, title, description, status, priority, assigneeId));
    }

    private TaskDocument newTask(String projectId, String title, String description,
                                 TaskDto.TaskStatus status, int priority, String assigneeId) {
        Instant now = clock.instant();
        TaskDocument doc = new TaskDocument();
        doc.setTaskId(UUID.randomUUID().toString());
        doc.setProjectId(projectId);
        doc.setTitle(title);
        doc.setDescription(description);
        doc.setStatus(status);
        doc.setPriority(priority);
        doc.setAssigneeId(assigneeId);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        if (status == TaskDto.TaskStatus.COMPLETED) {
            doc.setCompletedAt(now);
        }
        return doc;
    }

    private TaskDocument save(TaskDocument doc) {
        TaskDocument saved = taskRepository.insert(doc);
        log.info("Created task {} in project {}: {}", saved.getTaskId(), saved.getProjectId(), saved.getTitle());
        return saved;
    }

    public List<TaskDto> listTasks(String projectId) {
        return taskRepository.findByProjectIdOrderByCreatedAtAsc(projectId).stream()
                .map(ProjectMapper::toDto)
                .toList();
    }
}
