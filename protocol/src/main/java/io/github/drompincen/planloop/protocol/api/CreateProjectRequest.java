package io.github.drompincen.planloop.protocol.api;

public record CreateProjectRequest(
        String name,
        String description,
        String ownerId,
        Boolean autoPlan
) {}
