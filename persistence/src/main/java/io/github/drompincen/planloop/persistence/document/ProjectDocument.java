package io.github.drompincen.planloop.persistence.document;

import io.github.drompincen.planloop.protocol.api.ProjectDto;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "projects")
public class ProjectDocument {

    @Id
    private String projectId;
    private String name;
    private String description;
    private ProjectDto.ProjectStatus status;
    @Indexed
    private String ownerId;
    private Instant createdAt;
    private Instant updatedAt;

    public ProjectDocument() {}

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public ProjectDto.ProjectStatus getStatus() { return status; }
    public void setStatus(ProjectDto.ProjectStatus status) { this.status = status; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
