package io.github.drompincen.planloop.runtime.parse;

/**
 * Model output with no usable interpretation at all, such as an empty completion.
 * Anything containing text degrades to a fallback instead of raising this.
 */
public class MalformedOutputException extends RuntimeException {

    public MalformedOutputException(String message) {
        super(message);
    }
}
