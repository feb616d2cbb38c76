package io.github.drompincen.planloop.protocol.api;

import java.time.LocalDate;

public record CreateTaskRequest(
        String title,
        String description,
        TaskDto.TaskStatus status,
        Integer priority,
        Double estimatedHours,
        LocalDate dueDate,
        String assigneeId
) {}
