package io.github.drompincen.planloop.runtime.parse;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.planloop.protocol.api.PlanContent;

import java.util.ArrayList;
import java.util.List;

public class PlanContentShape implements OutputShape<PlanContent> {

    public static final PlanContentShape INSTANCE = new PlanContentShape();

    static final String DEFAULT_SUMMARY = "Project plan";
    static final String FALLBACK_SUMMARY = "Failed to generate plan";

    @Override
    public boolean accepts(JsonNode node) {
        return node.isObject();
    }

    @Override
    public PlanContent fromJson(JsonNode node) {
        if (!node.isObject()) {
            return fallback(node.toString());
        }
        String summary = JsonFields.text(node, "summary");
        return new PlanContent(
                summary != null ? summary : DEFAULT_SUMMARY,
                JsonFields.strings(node, "goals"),
                roadmapSteps(node.get("roadmap_steps")),
                milestones(node.get("milestones")),
                JsonFields.strings(node, "risks"),
                JsonFields.strings(node, "next_steps"));
    }

    @Override
    public PlanContent fallback(String rawText) {
        return PlanContent.empty(FALLBACK_SUMMARY);
    }

    @Override
    public String name() {
        return "plan content";
    }

    private List<PlanContent.RoadmapStep> roadmapSteps(JsonNode list) {
        List<PlanContent.RoadmapStep> steps = new ArrayList<>();
        if (list == null || !list.isArray()) return steps;
        int position = 0;
        for (JsonNode item : list) {
            position++;
            if (!item.isObject()) continue;
            steps.add(new PlanContent.RoadmapStep(
                    JsonFields.intValue(item, "step_number", position),
                    JsonFields.text(item, "title"),
                    JsonFields.text(item, "description"),
                    JsonFields.text(item, "estimated_duration"),
                    JsonFields.ints(item, "dependencies")));
        }
        return steps;
    }

    private List<PlanContent.Milestone> milestones(JsonNode list) {
        List<PlanContent.Milestone> milestones = new ArrayList<>();
        if (list == null || !list.isArray()) return milestones;
        for (JsonNode item : list) {
            if (!item.isObject()) continue;
            milestones.add(new PlanContent.Milestone(
                    JsonFields.text(item, "title"),
                    JsonFields.text(item, "target_date"),
                    JsonFields.strings(item, "deliverables")));
        }
        return milestones;
    }
}
