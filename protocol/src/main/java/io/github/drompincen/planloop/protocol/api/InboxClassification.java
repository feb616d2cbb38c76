package io.github.drompincen.planloop.protocol.api;

public record InboxClassification(
        ClassificationAction action,
        String projectName,
        String projectDescription,
        String taskTitle,
        String taskDescription,
        String taskPriority,
        String suggestedProjectId,
        String suggestedTaskId,
        String reasoning
) {
    public static InboxClassification noAction(String reasoning) {
        return new InboxClassification(ClassificationAction.NO_ACTION,
                null, null, null, null, null, null, null, reasoning);
    }
}
