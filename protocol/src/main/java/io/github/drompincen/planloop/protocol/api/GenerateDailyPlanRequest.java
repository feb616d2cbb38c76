package io.github.drompincen.planloop.protocol.api;

import java.time.LocalDate;

public record GenerateDailyPlanRequest(
        String userId,
        LocalDate targetDate,
        boolean regenerate
) {}
