package io.github.drompincen.planloop.persistence.document;

import io.github.drompincen.planloop.protocol.api.InboxClassification;
import io.github.drompincen.planloop.protocol.api.InboxItemDto;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Document(collection = "inbox_items")
@CompoundIndex(name = "user_status", def = "{'userId': 1, 'status': 1}")
public class InboxItemDocument {

    @Id
    private String inboxItemId;
    private String userId;
    private String content;
    private List<String> tags;
    private InboxItemDto.InboxStatus status;
    private InboxClassification classification;
    private String projectId;
    private String taskId;
    private String failureReason;
    private Instant createdAt;
    private Instant updatedAt;

    public InboxItemDocument() {}

    public String getInboxItemId() { return inboxItemId; }
    public void setInboxItemId(String inboxItemId) { this.inboxItemId = inboxItemId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public List<String> getTags() { return tags; }
    public void setTags(List<String> tags) { this.tags = tags; }

    public InboxItemDto.InboxStatus getStatus() { return status; }
    public void setStatus(InboxItemDto.InboxStatus status) { this.status = status; }

    public InboxClassification getClassification() { return classification; }
    public void setClassification(InboxClassification classification) { this.classification = classification; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public String getFailureReason() { return failureReason; }
    public void setFailureReason(String failureReason) { this.failureReason = failureReason; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
