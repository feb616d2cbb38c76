package io.github.drompincen.planloop.protocol.api;

public record MarkTaskCompleteRequest(
        String taskId,
        String userId,
        Double hoursWorked
) {}
