package io.github.drompincen.planloop.protocol.api;

import java.time.Instant;

public record PlanVersionDto(
        String planVersionId,
        String projectId,
        int versionNumber,
        PlanContent content,
        String createdBy,
        Instant createdAt
) {}
