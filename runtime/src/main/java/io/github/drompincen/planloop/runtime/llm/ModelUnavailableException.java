package io.github.drompincen.planloop.runtime.llm;

public class ModelUnavailableException extends ModelException {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
