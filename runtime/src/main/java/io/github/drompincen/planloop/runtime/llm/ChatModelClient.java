package io.github.drompincen.planloop.runtime.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.retry.NonTransientAiException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base for clients backed by a Spring AI {@link ChatModel}. The blocking chat call runs on a
 * daemon pool so the caller can give up after the configured timeout.
 */
public abstract class ChatModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(ChatModelClient.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
    private static final ExecutorService CALL_EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "model-call-" + THREAD_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final ChatModel chatModel;
    private final String model;
    private final Duration timeout;

    protected ChatModelClient(ChatModel chatModel, String model, Duration timeout) {
        this.chatModel = chatModel;
        this.model = model;
        this.timeout = timeout;
    }

    protected abstract ChatOptions options(int maxTokens, double temperature);

    @Override
    public String model() {
        return model;
    }

    public boolean isAvailable() {
        return chatModel != null;
    }

    @Override
    public ModelResponse generate(String prompt, String systemInstructions, int maxTokens, double temperature) {
        if (chatModel == null) {
            throw new ModelUnavailableException("No API key configured for provider " + provider());
        }
        Prompt request = new Prompt(
                List.of(new SystemMessage(systemInstructions), new UserMessage(prompt)),
                options(maxTokens, temperature));

        long start = System.currentTimeMillis();
        // cancel(true) interrupts the call thread on timeout
        Future<ChatResponse> future = CALL_EXECUTOR.submit(() -> chatModel.call(request));
        ChatResponse response;
        try {
            response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ModelTimeoutException(provider(), timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ModelUnavailableException("Interrupted while waiting for " + provider(), e);
        } catch (ExecutionException e) {
            throw translate(e.getCause() != null ? e.getCause() : e);
        }
        long durationMs = System.currentTimeMillis() - start;
        return toModelResponse(response, durationMs);
    }

    private ModelResponse toModelResponse(ChatResponse response, long durationMs) {
        String text = "";
        if (response != null && response.getResult() != null && response.getResult().getOutput() != null) {
            String output = response.getResult().getOutput().getText();
            text = output != null ? output : "";
        }
        String responseModel = model;
        int promptTokens = 0;
        int completionTokens = 0;
        int totalTokens = 0;
        if (response != null && response.getMetadata() != null) {
            if (response.getMetadata().getModel() != null && !response.getMetadata().getModel().isBlank()) {
                responseModel = response.getMetadata().getModel();
            }
            Usage usage = response.getMetadata().getUsage();
            if (usage != null) {
                promptTokens = orZero(usage.getPromptTokens());
                completionTokens = orZero(usage.getCompletionTokens());
                totalTokens = orZero(usage.getTotalTokens());
            }
        }
        log.debug("{} call finished in {} ms ({} tokens)", provider(), durationMs, totalTokens);
        return new ModelResponse(text, responseModel, promptTokens, completionTokens, totalTokens, durationMs);
    }

    static ModelException translate(Throwable cause) {
        if (cause instanceof ModelException modelException) {
            return modelException;
        }
        if (cause instanceof NonTransientAiException) {
            String message = cause.getMessage() != null ? cause.getMessage() : "";
            // auth and rate limit come back as non-transient 4xx but are not the request's fault
            if (message.startsWith("401") || message.startsWith("403") || message.startsWith("429")) {
                return new ModelUnavailableException(message, cause);
            }
            return new ModelRejectedException(message, cause);
        }
        return new ModelUnavailableException(String.valueOf(cause.getMessage()), cause);
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    static boolean hasRealKey(String key) {
        return key != null && !key.isBlank() && !key.contains("placeholder");
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
