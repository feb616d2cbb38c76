package io.github.drompincen.planloop.runtime.feedback;

import io.github.drompincen.planloop.persistence.document.FeedbackDocument;
import io.github.drompincen.planloop.persistence.document.ProjectDocument;
import io.github.drompincen.planloop.persistence.document.TaskDocument;
import io.github.drompincen.planloop.persistence.repository.FeedbackRepository;
import io.github.drompincen.planloop.persistence.repository.ProjectRepository;
import io.github.drompincen.planloop.persistence.repository.TaskRepository;
import io.github.drompincen.planloop.protocol.api.AdjustmentDto;
import io.github.drompincen.planloop.runtime.config.PlanloopProperties;
import io.github.drompincen.planloop.runtime.llm.CallContext;
import io.github.drompincen.planloop.runtime.llm.ModelInvoker;
import io.github.drompincen.planloop.runtime.parse.FeedbackAnalysis;
import io.github.drompincen.planloop.runtime.parse.FeedbackAnalysisShape;
import io.github.drompincen.planloop.runtime.parse.ParsedAdjustment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns one pending feedback row into adjustments.
 * <p>
 * The row's status is the lock: PENDING to PROCESSING is claimed atomically before any
 * model work, and adjustments are written together with COMPLETED in one update. A caller
 * that loses the claim returns {@link ProcessingOutcome#SKIPPED} without side effects.
 */
@Service
public class FeedbackProcessingPipeline {

    private static final Logger log = LoggerFactory.getLogger(FeedbackProcessingPipeline.class);

    private final FeedbackRepository feedbackRepository;
    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;
    private final FeedbackPromptBuilder promptBuilder;
    private final ModelInvoker modelInvoker;
    private final PlanloopProperties properties;
    private final Clock clock;

    public FeedbackProcessingPipeline(FeedbackRepository feedbackRepository,
                                      ProjectRepository projectRepository,
                                      TaskRepository taskRepository,
                                      FeedbackPromptBuilder promptBuilder,
                                      ModelInvoker modelInvoker,
                                      PlanloopProperties properties,
                                      Clock clock) {
        this.feedbackRepository = feedbackRepository;
        this.projectRepository = projectRepository;
        this.taskRepository = taskRepository;
        this.promptBuilder = promptBuilder;
        this.modelInvoker = modelInvoker;
        this.properties = properties;
        this.clock = clock;
    }

    public ProcessingOutcome process(String feedbackId) {
        if (!feedbackRepository.claimForProcessing(feedbackId, clock.instant())) {
            log.info("Feedback {} is not pending or was claimed by another worker, skipping", feedbackId);
            return ProcessingOutcome.SKIPPED;
        }

        Optional<FeedbackDocument> loaded = feedbackRepository.findById(feedbackId);
        if (loaded.isEmpty()) {
            log.warn("Feedback {} disappeared after it was claimed", feedbackId);
            return ProcessingOutcome.SKIPPED;
        }
        FeedbackDocument feedback = loaded.get();

        Optional<ProjectDocument> project = projectRepository.findById(feedback.getProjectId());
        if (project.isEmpty()) {
            return fail(feedbackId, "Project not found: " + feedback.getProjectId());
        }
        List<TaskDocument> tasks = taskRepository.findByProjectIdOrderByCreatedAtAsc(feedback.getProjectId());

        String prompt = promptBuilder.build(project.get(), tasks, feedback);
        FeedbackAnalysis analysis;
        try {
            analysis = modelInvoker.invoke(
                    new CallContext(CallContext.FEEDBACK, feedbackId, feedback.getUserName()),
                    prompt,
                    properties.getFeedback().toModelConfig(FeedbackPromptBuilder.SYSTEM_PROMPT),
                    FeedbackAnalysisShape.INSTANCE);
        } catch (RuntimeException e) {
            return fail(feedbackId, "Model call failed: " + e.getMessage());
        }

        Set<String> projectTaskIds = tasks.stream().map(TaskDocument::getTaskId).collect(Collectors.toSet());
        Instant now = clock.instant();
        List<AdjustmentDto> adjustments = analysis.adjustments().stream()
                .map(parsed -> toAdjustment(feedbackId, parsed, projectTaskIds, now))
                .toList();

        if (!feedbackRepository.completeWithAdjustments(feedbackId, analysis.summary(), adjustments, now)) {
            log.warn("Feedback {} was no longer PROCESSING when completing, adjustments discarded", feedbackId);
            return ProcessingOutcome.SKIPPED;
        }
        log.info("Feedback {} completed with {} adjustment(s)", feedbackId, adjustments.size());
        return ProcessingOutcome.COMPLETED;
    }

    private ProcessingOutcome fail(String feedbackId, String reason) {
        log.error("Feedback {} failed: {}", feedbackId, reason);
        if (!feedbackRepository.markFailed(feedbackId, reason, clock.instant())) {
            log.warn("Feedback {} was no longer PROCESSING when marking failed", feedbackId);
            return ProcessingOutcome.SKIPPED;
        }
        return ProcessingOutcome.FAILED;
    }

    private AdjustmentDto toAdjustment(String feedbackId, ParsedAdjustment parsed,
                                       Set<String> projectTaskIds, Instant now) {
        ParsedAdjustment scoped = parsed;
        if (parsed.taskId() != null && !projectTaskIds.contains(parsed.taskId())) {
            log.debug("Adjustment for feedback {} references unknown task {}, dropping the reference",
                    feedbackId, parsed.taskId());
            scoped = parsed.withoutTask();
        }
        return new AdjustmentDto(
                UUID.randomUUID().toString(),
                feedbackId,
                scoped.type(),
                scoped.taskId(),
                scoped.description(),
                scoped.originalValue(),
                scoped.newValue(),
                scoped.reasoning(),
                now);
    }
}
