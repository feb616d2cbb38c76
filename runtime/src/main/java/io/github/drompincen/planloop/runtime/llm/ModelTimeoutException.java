package io.github.drompincen.planloop.runtime.llm;

import java.time.Duration;

public class ModelTimeoutException extends ModelException {

    public ModelTimeoutException(String provider, Duration timeout) {
        super(provider + " call did not complete within " + timeout.toMillis() + " ms");
    }
}
