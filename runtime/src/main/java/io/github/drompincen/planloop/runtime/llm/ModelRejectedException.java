package io.github.drompincen.planloop.runtime.llm;

public class ModelRejectedException extends ModelException {

    public ModelRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
