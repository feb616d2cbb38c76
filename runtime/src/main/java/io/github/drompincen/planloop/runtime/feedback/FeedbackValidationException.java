package io.github.drompincen.planloop.runtime.feedback;

/**
 * Feedback rejected at submission. Nothing has been stored or queued when this is thrown.
 */
public class FeedbackValidationException extends RuntimeException {

    public FeedbackValidationException(String message) {
        super(message);
    }
}
