package io.github.drompincen.planloop.persistence.document;

import io.github.drompincen.planloop.protocol.api.LlmCallStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.IndexDirection;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Audit row for a single model call attempt. Written for successes and failures alike.
 */
@Document(collection = "llm_call_logs")
@CompoundIndex(name = "reference_time", def = "{'referenceId': 1, 'timestamp': 1}")
public class LlmCallLogDocument {

    @Id
    private String callId;
    private String userId;
    private String purpose;          // "feedback", "planning" or "inbox"
    private String referenceId;      // feedback, project or inbox item id
    private String provider;
    private String model;
    private int attempt;             // 1-based within one retried operation
    private String prompt;
    private String response;
    private int promptTokens;
    private int completionTokens;
    private int totalTokens;
    private long durationMs;
    private LlmCallStatus status;
    private String errorMessage;
    private Map<String, Object> metadata;
    @Indexed(direction = IndexDirection.DESCENDING)
    private Instant timestamp;

    public LlmCallLogDocument() {}

    public String getCallId() { return callId; }
    public void setCallId(String callId) { this.callId = callId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getPurpose() { return purpose; }
    public void setPurpose(String purpose) { this.purpose = purpose; }

    public String getReferenceId() { return referenceId; }
    public void setReferenceId(String referenceId) { this.referenceId = referenceId; }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public int getAttempt() { return attempt; }
    public void setAttempt(int attempt) { this.attempt = attempt; }

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }

    public String getResponse() { return response; }
    public void setResponse(String response) { this.response = response; }

    public int getPromptTokens() { return promptTokens; }
    public void setPromptTokens(int promptTokens) { this.promptTokens = promptTokens; }

    public int getCompletionTokens() { return completionTokens; }
    public void setCompletionTokens(int completionTokens) { this.completionTokens = completionTokens; }

    public int getTotalTokens() { return totalTokens; }
    public void setTotalTokens(int totalTokens) { this.totalTokens = totalTokens; }

    public long getDurationMs() { return durationMs; }
    public void setDurationMs(long durationMs) { this.durationMs = durationMs; }

    public LlmCallStatus getStatus() { return status; }
    public void setStatus(LlmCallStatus status) { this.status = status; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
