package io.github.drompincen.planloop.runtime.parse;

import io.github.drompincen.planloop.protocol.api.AdjustmentType;

public record ParsedAdjustment(
        AdjustmentType type,
        String taskId,
        String description,
        String originalValue,
        String newValue,
        String reasoning
) {
    public ParsedAdjustment withoutTask() {
        return new ParsedAdjustment(type, null, description, originalValue, newValue, reasoning);
    }
}
