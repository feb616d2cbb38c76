package io.github.drompincen.planloop.runtime.llm;

import io.github.drompincen.planloop.runtime.config.PlanloopProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
@ConditionalOnProperty(name = "planloop.llm.provider", havingValue = "anthropic")
public class AnthropicModelClient extends ChatModelClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicModelClient.class);

    public static final String DEFAULT_MODEL = "claude-sonnet-4-5-20250929";

    @Autowired
    public AnthropicModelClient(PlanloopProperties properties) {
        this(createChatModel(properties.getLlm()), modelName(properties.getLlm()), properties.getLlm().getTimeout());
    }

    AnthropicModelClient(ChatModel chatModel, String model, Duration timeout) {
        super(chatModel, model, timeout);
        log.info("Anthropic model client initialized: model={}, available={}", model, chatModel != null);
    }

    @Override
    public String provider() {
        return "anthropic";
    }

    @Override
    protected ChatOptions options(int maxTokens, double temperature) {
        return AnthropicChatOptions.builder()
                .model(model())
                .maxTokens(maxTokens)
                .temperature(temperature)
                .build();
    }

    private static String modelName(PlanloopProperties.Llm llm) {
        return hasText(llm.getModel()) ? llm.getModel() : DEFAULT_MODEL;
    }

    private static ChatModel createChatModel(PlanloopProperties.Llm llm) {
        if (!hasRealKey(llm.getApiKey())) {
            log.warn("No Anthropic API key configured; model calls will fail as unavailable");
            return null;
        }
        AnthropicApi.Builder api = AnthropicApi.builder().apiKey(llm.getApiKey());
        if (hasText(llm.getBaseUrl())) {
            api.baseUrl(llm.getBaseUrl());
        }
        return AnthropicChatModel.builder()
                .anthropicApi(api.build())
                .defaultOptions(AnthropicChatOptions.builder().model(modelName(llm)).build())
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();
    }
}
