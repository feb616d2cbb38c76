package io.github.drompincen.planloop.protocol.api;

import java.time.Instant;
import java.util.List;

public record FeedbackDto(
        String feedbackId,
        String projectId,
        String taskId,
        String userName,
        String feedbackText,
        FeedbackStatus status,
        String summary,
        String failureReason,
        Instant createdAt,
        Instant processedAt,
        List<AdjustmentDto> adjustments
) {}
