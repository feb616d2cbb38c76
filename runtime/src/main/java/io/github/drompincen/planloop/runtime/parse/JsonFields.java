package io.github.drompincen.planloop.runtime.parse;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/** Lenient readers for model-produced JSON where any field may be missing or mistyped. */
final class JsonFields {

    private JsonFields() {}

    static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) return null;
        if (value.isContainerNode()) return value.toString();
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }

    static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) return value;
        }
        return null;
    }

    static List<String> strings(JsonNode node, String field) {
        List<String> result = new ArrayList<>();
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) return result;
        if (value.isArray()) {
            for (JsonNode item : value) {
                if (item.isNull()) continue;
                String text = item.isContainerNode() ? item.toString() : item.asText();
                if (!text.isBlank()) result.add(text.trim());
            }
        } else if (value.isValueNode() && !value.asText().isBlank()) {
            result.add(value.asText().trim());
        }
        return result;
    }

    static List<Integer> ints(JsonNode node, String field) {
        List<Integer> result = new ArrayList<>();
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isArray()) return result;
        for (JsonNode item : value) {
            if (item.isInt() || item.isLong()) {
                result.add(item.asInt());
            } else if (item.isTextual()) {
                Integer parsed = parseInt(item.asText());
                if (parsed != null) result.add(parsed);
            }
        }
        return result;
    }

    static int intValue(JsonNode node, String field, int defaultValue) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) return defaultValue;
        if (value.isNumber()) return value.asInt();
        Integer parsed = parseInt(value.asText());
        return parsed != null ? parsed : defaultValue;
    }

    static Integer parseInt(String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String truncate(String text, int max) {
        if (text == null) return null;
        String trimmed = text.trim();
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max) + "...";
    }
}
