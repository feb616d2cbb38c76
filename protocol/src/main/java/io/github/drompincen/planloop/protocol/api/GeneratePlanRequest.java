package io.github.drompincen.planloop.protocol.api;

public record GeneratePlanRequest(
        String projectId,
        String userId,
        boolean forceRegenerate
) {}
