package io.github.drompincen.planloop.protocol.api;

public enum FeedbackStatus {
    PENDING, PROCESSING, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
