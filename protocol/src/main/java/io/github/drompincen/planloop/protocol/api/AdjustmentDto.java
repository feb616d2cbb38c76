package io.github.drompincen.planloop.protocol.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AdjustmentDto(
        String adjustmentId,
        String feedbackId,
        AdjustmentType adjustmentType,
        String taskId,
        String description,
        String originalValue,
        String newValue,
        String reasoning,
        Instant createdAt
) {}
