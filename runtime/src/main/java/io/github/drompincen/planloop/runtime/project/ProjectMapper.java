package io.github.drompincen.planloop.runtime.project;

import io.github.drompincen.planloop.persistence.document.ProjectDocument;
import io.github.drompincen.planloop.persistence.document.TaskDocument;
import io.github.drompincen.planloop.protocol.api.ProjectDto;
import io.github.drompincen.planloop.protocol.api.TaskDto;

public final class ProjectMapper {

    private ProjectMapper() {}

    public static ProjectDto toDto(ProjectDocument doc) {
        return new ProjectDto(doc.getProjectId(), doc.getName(), doc.getDescription(), doc.getStatus(),
                doc.getOwnerId(), doc.getCreatedAt(), doc.getUpdatedAt());
    }

    public static TaskDto toDto(TaskDocument doc) {
        return new TaskDto(doc.getTaskId(), doc.getProjectId(), doc.getTitle(), doc.getDescription(),
                doc.getStatus(), doc.getPriority(), doc.getEstimatedHours(), doc.getDueDate(),
                doc.getAssigneeId(), doc.getCreatedAt(), doc.getUpdatedAt(), doc.getCompletedAt());
    }
}
