package io.github.drompincen.planloop.runtime.ledger;

import io.github.drompincen.planloop.persistence.document.LlmCallLogDocument;
import io.github.drompincen.planloop.persistence.repository.LlmCallLogRepository;
import io.github.drompincen.planloop.protocol.api.LlmCallStatus;
import io.github.drompincen.planloop.runtime.llm.CallContext;
import io.github.drompincen.planloop.runtime.llm.ModelResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit of model call attempts. A failed write is logged and dropped so
 * auditing never changes the outcome of the call being audited.
 */
@Service
public class LlmCallLedger {

    private static final Logger log = LoggerFactory.getLogger(LlmCallLedger.class);

    private final LlmCallLogRepository repository;
    private final Clock clock;

    public LlmCallLedger(LlmCallLogRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public void record(CallContext context, int attempt, String provider, String model, String prompt,
                       ModelResponse response, LlmCallStatus status, String errorMessage, long durationMs) {
        try {
            LlmCallLogDocument doc = new LlmCallLogDocument();
            doc.setCallId(UUID.randomUUID().toString());
            doc.setUserId(context.userId());
            doc.setPurpose(context.purpose());
            doc.setReferenceId(context.referenceId());
            doc.setProvider(provider);
            doc.setModel(response != null && response.model() != null ? response.model() : model);
            doc.setAttempt(attempt);
            doc.setPrompt(prompt);
            doc.setStatus(status);
            doc.setErrorMessage(errorMessage);
            doc.setDurationMs(durationMs);
            if (response != null) {
                doc.setResponse(response.text());
                doc.setPromptTokens(response.promptTokens());
                doc.setCompletionTokens(response.completionTokens());
                doc.setTotalTokens(response.totalTokens());
            }
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("operation", context.operationName());
            doc.setMetadata(metadata);
            doc.setTimestamp(Instant.now(clock));
            repository.save(doc);
        } catch (Exception e) {
            log.error("Failed to persist model call record for {}: {}", context.operationName(), e.getMessage(), e);
        }
    }

    public List<LlmCallLogDocument> findByReference(String referenceId) {
        return repository.findByReferenceIdOrderByTimestampAsc(referenceId);
    }
}
