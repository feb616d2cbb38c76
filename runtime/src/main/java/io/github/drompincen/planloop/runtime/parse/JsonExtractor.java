package io.github.drompincen.planloop.runtime.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Finds the first well-formed JSON object or array embedded in free text.
 * <p>
 * Each '{' or '[' is tried as a start; the matching close is located by tracking nesting
 * depth while skipping over string literals (including escaped quotes), so braces inside
 * string values do not end a candidate early. The first candidate that Jackson reads and the
 * caller's filter accepts wins; rejected candidates are skipped and scanning continues, so a
 * stray {@code [1]} in prose does not hide the object after it. Code fences and surrounding
 * prose need no special handling.
 */
public class JsonExtractor {

    private final ObjectMapper objectMapper;

    public JsonExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<JsonNode> extractFirst(String text) {
        return extractFirst(text, node -> true);
    }

    public Optional<JsonNode> extractFirst(String text, Predicate<JsonNode> accepts) {
        if (text == null || text.isEmpty()) return Optional.empty();
        for (int start = 0; start < text.length(); start++) {
            char c = text.charAt(start);
            if (c != '{' && c != '[') continue;
            int end = findBalancedEnd(text, start);
            if (end < 0) continue;
            Optional<JsonNode> node = readContainer(text.substring(start, end + 1));
            if (node.isPresent() && accepts.test(node.get())) return node;
        }
        return Optional.empty();
    }

    private Optional<JsonNode> readContainer(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isContainerNode() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /** Index of the bracket closing the one at {@code start}, or -1 if it never closes. */
    static int findBalancedEnd(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{', '[' -> depth++;
                case '}', ']' -> {
                    depth--;
                    if (depth == 0) return i;
                    if (depth < 0) return -1;
                }
                default -> { }
            }
        }
        return -1;
    }
}
