package io.github.drompincen.planloop.persistence.document;

import io.github.drompincen.planloop.protocol.api.TaskDto;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

@Document(collection = "tasks")
@CompoundIndexes({
        @CompoundIndex(name = "project_status", def = "{'projectId': 1, 'status': 1}"),
        @CompoundIndex(name = "assignee_status", def = "{'assigneeId': 1, 'status': 1}")
})
public class TaskDocument {

    @Id
    private String taskId;
    private String projectId;
    private String title;
    private String description;
    private TaskDto.TaskStatus status;
    private int priority;            // 0-10, see TaskPriority
    private Double estimatedHours;
    private LocalDate dueDate;
    private String assigneeId;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    public TaskDocument() {}

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public TaskDto.TaskStatus getStatus() { return status; }
    public void setStatus(TaskDto.TaskStatus status) { this.status = status; }

    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }

    public Double getEstimatedHours() { return estimatedHours; }
    public void setEstimatedHours(Double estimatedHours) { this.estimatedHours = estimatedHours; }

    public LocalDate getDueDate() { return dueDate; }
    public void setDueDate(LocalDate dueDate) { this.dueDate = dueDate; }

    public String getAssigneeId() { return assigneeId; }
    public void setAssigneeId(String assigneeId) { this.assigneeId = assigneeId; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
}
