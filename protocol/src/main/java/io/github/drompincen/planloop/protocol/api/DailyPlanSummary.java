package io.github.drompincen.planloop.protocol.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDate;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DailyPlanSummary(
        LocalDate date,
        int totalTasks,
        int completedTasks,
        double completionRate,
        double totalHoursWorked,
        List<Entry> summaries
) {
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Entry(
            int rank,
            String taskId,
            String summaryText,
            boolean completed,
            Double hoursWorked
    ) {}
}
