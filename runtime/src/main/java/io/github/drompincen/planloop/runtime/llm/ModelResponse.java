package io.github.drompincen.planloop.runtime.llm;

public record ModelResponse(
        String text,
        String model,
        int promptTokens,
        int completionTokens,
        int totalTokens,
        long durationMs
) {}
