package io.github.drompincen.planloop.protocol.api;

/**
 * Per-call generation settings handed to a model client.
 */
public record ModelConfig(
        double temperature,
        int maxTokens,
        String systemPrompt
) {
    public ModelConfig withSystemPrompt(String prompt) {
        return new ModelConfig(temperature, maxTokens, prompt);
    }
}
