package io.github.drompincen.planloop.runtime.llm;

/**
 * Identifies what a model call is for, so ledger rows can be traced back to their subject.
 *
 * @param purpose     "feedback", "planning" or "inbox"
 * @param referenceId id of the feedback, project or inbox item being processed
 * @param userId      user on whose behalf the call is made, may be null
 */
public record CallContext(String purpose, String referenceId, String userId) {

    public static final String FEEDBACK = "feedback";
    public static final String PLANNING = "planning";
    public static final String INBOX = "inbox";

    public String operationName() {
        return purpose + ":" + referenceId;
    }
}
