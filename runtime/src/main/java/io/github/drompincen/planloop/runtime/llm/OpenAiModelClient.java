package io.github.drompincen.planloop.runtime.llm;

import io.github.drompincen.planloop.runtime.config.PlanloopProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
@ConditionalOnProperty(name = "planloop.llm.provider", havingValue = "openai", matchIfMissing = true)
public class OpenAiModelClient extends ChatModelClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiModelClient.class);

    public static final String DEFAULT_MODEL = "gpt-4o";

    @Autowired
    public OpenAiModelClient(PlanloopProperties properties) {
        this(createChatModel(properties.getLlm()), modelName(properties.getLlm()), properties.getLlm().getTimeout());
    }

    OpenAiModelClient(ChatModel chatModel, String model, Duration timeout) {
        super(chatModel, model, timeout);
        log.info("OpenAI model client initialized: model={}, available={}", model, chatModel != null);
    }

    @Override
    public String provider() {
        return "openai";
    }

    @Override
    protected ChatOptions options(int maxTokens, double temperature) {
        return OpenAiChatOptions.builder()
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
            log.warn("No OpenAI API key configured; model calls will fail as unavailable");
            return null;
        }
        OpenAiApi.Builder api = OpenAiApi.builder().apiKey(llm.getApiKey());
        if (hasText(llm.getBaseUrl())) {
            api.baseUrl(llm.getBaseUrl());
        }
        return OpenAiChatModel.builder()
                .openAiApi(api.build())
                .defaultOptions(OpenAiChatOptions.builder().model(modelName(llm)).build())
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();
    }
}
