package io.github.drompincen.planloop.protocol.api;

public record SubmitFeedbackRequest(
        String projectId,
        String taskId,
        String userName,
        String feedbackText
) {}
