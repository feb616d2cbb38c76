package io.github.drompincen.planloop.runtime.parse;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.planloop.protocol.api.AdjustmentType;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code {"summary": ..., "adjustments": [...]}}. A bare array is taken as the
 * adjustments list. With no usable adjustments the result is a single {@code general}
 * adjustment carrying whatever the model did say.
 */
public class FeedbackAnalysisShape implements OutputShape<FeedbackAnalysis> {

    public static final FeedbackAnalysisShape INSTANCE = new FeedbackAnalysisShape();

    static final String DEFAULT_SUMMARY = "Feedback analyzed";
    static final String NO_CHANGES = "No specific adjustments suggested";
    static final String UNSTRUCTURED_REASONING = "Model response was not structured; kept as a general note";

    @Override
    public boolean accepts(JsonNode node) {
        if (node.isObject()) {
            return node.has("adjustments") || node.has("summary") || node.has("analysis");
        }
        if (!node.isArray() || node.isEmpty()) return false;
        for (JsonNode item : node) {
            if (!item.isObject()) return false;
        }
        return true;
    }

    @Override
    public FeedbackAnalysis fromJson(JsonNode node) {
        JsonNode list = node.isArray() ? node : node.get("adjustments");
        String summary = node.isObject() ? JsonFields.firstText(node, "summary", "analysis") : null;

        List<ParsedAdjustment> adjustments = new ArrayList<>();
        if (list != null && list.isArray()) {
            for (JsonNode item : list) {
                if (item.isObject()) {
                    ParsedAdjustment adjustment = toAdjustment(item);
                    if (adjustment != null) adjustments.add(adjustment);
                }
            }
        }
        if (adjustments.isEmpty()) {
            String description = summary != null ? summary : NO_CHANGES;
            adjustments.add(new ParsedAdjustment(AdjustmentType.GENERAL, null, description, null, null,
                    "No structured adjustments were returned"));
        }
        return new FeedbackAnalysis(summary != null ? summary : DEFAULT_SUMMARY, adjustments);
    }

    @Override
    public FeedbackAnalysis fallback(String rawText) {
        String text = JsonFields.truncate(rawText, 2000);
        ParsedAdjustment general = new ParsedAdjustment(AdjustmentType.GENERAL, null, text, null, null,
                UNSTRUCTURED_REASONING);
        return new FeedbackAnalysis(JsonFields.truncate(rawText, 200), List.of(general));
    }

    @Override
    public String name() {
        return "feedback analysis";
    }

    private ParsedAdjustment toAdjustment(JsonNode item) {
        String description = JsonFields.firstText(item, "description", "new_value", "reasoning");
        if (description == null) return null;
        AdjustmentType type = AdjustmentType.fromWire(JsonFields.firstText(item, "adjustment_type", "type"));
        return new ParsedAdjustment(
                type,
                JsonFields.firstText(item, "task_id", "taskId"),
                description,
                JsonFields.text(item, "original_value"),
                JsonFields.text(item, "new_value"),
                JsonFields.text(item, "reasoning"));
    }
}
