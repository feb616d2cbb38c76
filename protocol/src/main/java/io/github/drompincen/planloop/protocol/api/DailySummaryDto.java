package io.github.drompincen.planloop.protocol.api;

import java.time.Instant;
import java.time.LocalDate;

public record DailySummaryDto(
        String summaryId,
        String userId,
        LocalDate date,
        String taskId,
        int rank,
        String summaryText,
        boolean completed,
        Double hoursWorked,
        Instant createdAt
) {}
