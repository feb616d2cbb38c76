package io.github.drompincen.planloop.runtime.parse;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Expected structure of a model response.
 *
 * @param <T> parsed result type
 */
public interface OutputShape<T> {

    /** Whether an extracted JSON candidate looks like this shape at all. */
    boolean accepts(JsonNode node);

    /** Builds the result from extracted JSON, defaulting whatever is missing. */
    T fromJson(JsonNode node);

    /** Result to use when the response contains no JSON at all. */
    T fallback(String rawText);

    String name();
}
