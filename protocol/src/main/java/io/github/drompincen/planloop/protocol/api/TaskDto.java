package io.github.drompincen.planloop.protocol.api;

import java.time.Instant;
import java.time.LocalDate;

public record TaskDto(
        String taskId,
        String projectId,
        String title,
        String description,
        TaskStatus status,
        int priority,
        Double estimatedHours,
        LocalDate dueDate,
        String assigneeId,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt
) {
    public enum TaskStatus {
        TODO, IN_PROGRESS, COMPLETED, BLOCKED
    }
}
