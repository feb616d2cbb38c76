package io.github.drompincen.planloop.protocol.api;

import java.time.Instant;

public record ProjectDto(
        String projectId,
        String name,
        String description,
        ProjectStatus status,
        String ownerId,
        Instant createdAt,
        Instant updatedAt
) {
    public enum ProjectStatus {
        ACTIVE, ON_HOLD, COMPLETED, CANCELLED
    }
}
