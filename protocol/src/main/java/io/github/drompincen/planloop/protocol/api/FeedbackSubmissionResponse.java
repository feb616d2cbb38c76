package io.github.drompincen.planloop.protocol.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FeedbackSubmissionResponse(
        String feedbackId,
        String status,
        String message
) {}
