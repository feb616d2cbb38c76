package io.github.drompincen.planloop.runtime.parse;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.planloop.protocol.api.ClassificationAction;
import io.github.drompincen.planloop.protocol.api.InboxClassification;

public class InboxClassificationShape implements OutputShape<InboxClassification> {

    public static final InboxClassificationShape INSTANCE = new InboxClassificationShape();

    @Override
    public boolean accepts(JsonNode node) {
        return node.isObject() && node.has("action");
    }

    @Override
    public InboxClassification fromJson(JsonNode node) {
        if (!node.isObject()) {
            return InboxClassification.noAction("Classification was not a JSON object");
        }
        ClassificationAction action = ClassificationAction.fromWire(JsonFields.text(node, "action"));
        return new InboxClassification(
                action,
                JsonFields.text(node, "project_name"),
                JsonFields.text(node, "project_description"),
                JsonFields.text(node, "task_title"),
                JsonFields.text(node, "task_description"),
                JsonFields.text(node, "task_priority"),
                JsonFields.text(node, "suggested_project_id"),
                JsonFields.text(node, "suggested_task_id"),
                JsonFields.text(node, "reasoning"));
    }

    @Override
    public InboxClassification fallback(String rawText) {
        return InboxClassification.noAction("Failed to parse model response");
    }

    @Override
    public String name() {
        return "inbox classification";
    }
}
