package io.github.drompincen.planloop.protocol.api;

public enum LlmCallStatus {
    SUCCESS, ERROR, TIMEOUT
}
