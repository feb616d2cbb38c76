package io.github.drompincen.planloop.runtime.llm;

import io.github.drompincen.planloop.protocol.api.LlmCallStatus;
import io.github.drompincen.planloop.protocol.api.ModelConfig;
import io.github.drompincen.planloop.runtime.ledger.LlmCallLedger;
import io.github.drompincen.planloop.runtime.parse.ModelOutputParser;
import io.github.drompincen.planloop.runtime.parse.OutputShape;
import io.github.drompincen.planloop.runtime.retry.RetryExecutor;
import org.springframework.stereotype.Service;

/**
 * Model call plus parse as one retryable unit. Each attempt is written to the ledger
 * before the retry decision is made, whatever its outcome.
 */
@Service
public class ModelInvoker {

    private final ModelClient modelClient;
    private final RetryExecutor retryExecutor;
    private final LlmCallLedger ledger;
    private final ModelOutputParser parser;

    public ModelInvoker(ModelClient modelClient, RetryExecutor retryExecutor,
                        LlmCallLedger ledger, ModelOutputParser parser) {
        this.modelClient = modelClient;
        this.retryExecutor = retryExecutor;
        this.ledger = ledger;
        this.parser = parser;
    }

    public <T> T invoke(CallContext context, String prompt, ModelConfig config, OutputShape<T> shape) {
        return retryExecutor.execute(context.operationName(),
                attempt -> attempt(context, attempt, prompt, config, shape));
    }

    private <T> T attempt(CallContext context, int attempt, String prompt, ModelConfig config, OutputShape<T> shape) {
        long start = System.currentTimeMillis();
        ModelResponse response = null;
        try {
            response = modelClient.generate(prompt, config.systemPrompt(), config.maxTokens(), config.temperature());
            T result = parser.parse(response.text(), shape);
            record(context, attempt, prompt, response, LlmCallStatus.SUCCESS, null, start);
            return result;
        } catch (ModelTimeoutException e) {
            record(context, attempt, prompt, null, LlmCallStatus.TIMEOUT, e.getMessage(), start);
            throw e;
        } catch (RuntimeException e) {
            record(context, attempt, prompt, response, LlmCallStatus.ERROR, e.getMessage(), start);
            throw e;
        }
    }

    private void record(CallContext context, int attempt, String prompt, ModelResponse response,
                        LlmCallStatus status, String error, long start) {
        long durationMs = response != null && response.durationMs() > 0
                ? response.durationMs()
                : System.currentTimeMillis() - start;
        ledger.record(context, attempt, modelClient.provider(), modelClient.model(), prompt,
                response, status, error, durationMs);
    }

    public String provider() {
        return modelClient.provider();
    }
}
