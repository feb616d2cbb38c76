package io.github.drompincen.planloop.runtime.planning;

import io.github.drompincen.planloop.runtime.config.PlanloopProperties;
import io.github.drompincen.planloop.runtime.worker.PipelineDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget plan generation for newly created projects. Whatever happens to the
 * generation, the project creation that triggered it is unaffected.
 */
@Component
public class PlanTrigger {

    private static final Logger log = LoggerFactory.getLogger(PlanTrigger.class);

    private final PlanningService planningService;
    private final PipelineDispatcher dispatcher;
    private final PlanloopProperties properties;

    public PlanTrigger(PlanningService planningService, PipelineDispatcher dispatcher, PlanloopProperties properties) {
        this.planningService = planningService;
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    /** @return true if generation was queued */
    public boolean onProjectCreated(String projectId, String userId, boolean autoPlan) {
        if (!autoPlan || !properties.getPlanning().isAutoGenerate()) {
            return false;
        }
        return dispatcher.submit("plan for project " + projectId, () -> {
            try {
                planningService.generatePlan(projectId, userId, false);
            } catch (RuntimeException e) {
                log.warn("Automatic plan generation for project {} failed: {}", projectId, e.getMessage());
            }
        });
    }
}
