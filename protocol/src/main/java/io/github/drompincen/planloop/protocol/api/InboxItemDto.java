package io.github.drompincen.planloop.protocol.api;

import java.time.Instant;
import java.util.List;

public record InboxItemDto(
        String inboxItemId,
        String userId,
        String content,
        List<String> tags,
        InboxStatus status,
        InboxClassification classification,
        String projectId,
        String taskId,
        String failureReason,
        Instant createdAt,
        Instant updatedAt
) {
    public enum InboxStatus {
        UNPROCESSED, PROCESSING, PROCESSED, FAILED
    }
}
