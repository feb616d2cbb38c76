package io.github.drompincen.planloop.protocol.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Structured body of a plan version. Serialized with snake_case keys; this shape is
 * a stable wire format consumed by clients.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlanContent(
        String summary,
        List<String> goals,
        List<RoadmapStep> roadmapSteps,
        List<Milestone> milestones,
        List<String> risks,
        List<String> nextSteps
) {
    public PlanContent {
        goals = goals == null ? List.of() : List.copyOf(goals);
        roadmapSteps = roadmapSteps == null ? List.of() : List.copyOf(roadmapSteps);
        milestones = milestones == null ? List.of() : List.copyOf(milestones);
        risks = risks == null ? List.of() : List.copyOf(risks);
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
    }

    public static PlanContent empty(String summary) {
        return new PlanContent(summary, List.of(), List.of(), List.of(), List.of(), List.of());
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RoadmapStep(
            int stepNumber,
            String title,
            String description,
            String estimatedDuration,
            List<Integer> dependencies
    ) {
        public RoadmapStep {
            dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Milestone(
            String title,
            String targetDate,
            List<String> deliverables
    ) {
        public Milestone {
            deliverables = deliverables == null ? List.of() : List.copyOf(deliverables);
        }
    }
}
