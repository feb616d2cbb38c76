package io.github.drompincen.planloop.persistence.document;

import io.github.drompincen.planloop.protocol.api.AdjustmentDto;
import io.github.drompincen.planloop.protocol.api.FeedbackStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * A piece of user feedback and, once processed, the adjustments derived from it.
 * <p>
 * Adjustments live inside the feedback row so that they and the COMPLETED status are
 * written by a single document update.
 */
@Document(collection = "feedback")
@CompoundIndexes({
        @CompoundIndex(name = "project_created", def = "{'projectId': 1, 'createdAt': -1}"),
        @CompoundIndex(name = "status_created", def = "{'status': 1, 'createdAt': 1}")
})
public class FeedbackDocument {

    @Id
    private String feedbackId;
    private String projectId;
    private String taskId;
    private String userName;
    private String feedbackText;
    private FeedbackStatus status;
    private String summary;
    private String failureReason;
    private Instant createdAt;
    private Instant processingStartedAt;
    private Instant processedAt;
    private List<AdjustmentDto> adjustments;

    public FeedbackDocument() {}

    public String getFeedbackId() { return feedbackId; }
    public void setFeedbackId(String feedbackId) { this.feedbackId = feedbackId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public String getUserName() { return userName; }
    public void setUserName(String userName) { this.userName = userName; }

    public String getFeedbackText() { return feedbackText; }
    public void setFeedbackText(String feedbackText) { this.feedbackText = feedbackText; }

    public FeedbackStatus getStatus() { return status; }
    public void setStatus(FeedbackStatus status) { this.status = status; }

    public String getSummary() { return summary; }
    public void setSummary(String summary) { this.summary = summary; }

    public String getFailureReason() { return failureReason; }
    public void setFailureReason(String failureReason) { this.failureReason = failureReason; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getProcessingStartedAt() { return processingStartedAt; }
    public void setProcessingStartedAt(Instant processingStartedAt) { this.processingStartedAt = processingStartedAt; }

    public Instant getProcessedAt() { return processedAt; }
    public void setProcessedAt(Instant processedAt) { this.processedAt = processedAt; }

    public List<AdjustmentDto> getAdjustments() { return adjustments; }
    public void setAdjustments(List<AdjustmentDto> adjustments) { this.adjustments = adjustments; }
}
