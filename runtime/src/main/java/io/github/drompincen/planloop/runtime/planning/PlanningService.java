package io.github.drompincen.planloop.runtime.planning;

import io.github.drompincen.planloop.persistence.document.PlanVersionDocument;
import io.github.drompincen.planloop.persistence.document.ProjectDocument;
import io.github.drompincen.planloop.persistence.document.TaskDocument;
import io.github.drompincen.planloop.persistence.repository.PlanVersionRepository;
import io.github.drompincen.planloop.persistence.repository.ProjectRepository;
import io.github.drompincen.planloop.persistence.repository.TaskRepository;
import io.github.drompincen.planloop.protocol.api.PlanContent;
import io.github.drompincen.planloop.protocol.api.PlanVersionDto;
import io.github.drompincen.planloop.runtime.config.PlanloopProperties;
import io.github.drompincen.planloop.runtime.llm.CallContext;
import io.github.drompincen.planloop.runtime.llm.ModelInvoker;
import io.github.drompincen.planloop.runtime.parse.PlanContentShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Versioned project plans. Versions are append-only and numbered from 1 per project.
 */
@Service
public class PlanningService {

    private static final Logger log = LoggerFactory.getLogger(PlanningService.class);

    static final int MAX_INSERT_ATTEMPTS = 3;

    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;
    private final PlanVersionRepository planVersionRepository;
    private final PlanPromptBuilder promptBuilder;
    private final ModelInvoker modelInvoker;
    private final PlanloopProperties properties;
    private final Clock clock;

    public PlanningService(ProjectRepository projectRepository,
                           TaskRepository taskRepository,
                           PlanVersionRepository planVersionRepository,
                           PlanPromptBuilder promptBuilder,
                           ModelInvoker modelInvoker,
                           PlanloopProperties properties,
                           Clock clock) {
        this.projectRepository = projectRepository;
        this.taskRepository = taskRepository;
        this.planVersionRepository = planVersionRepository;
        this.promptBuilder = promptBuilder;
        this.modelInvoker = modelInvoker;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Returns the latest plan unchanged when one exists and {@code forceRegenerate} is false.
     * Otherwise asks the model for a new plan and stores it as the next version.
     *
     * @throws IllegalArgumentException if the project does not exist
     */
    public PlanVersionDto generatePlan(String projectId, String userId, boolean forceRegenerate) {
        ProjectDocument project = projectRepository.findById(projectId)
                .orElseThrow(() -> new IllegalArgumentException("Project not found: " + projectId));

        if (!forceRegenerate) {
            Optional<PlanVersionDocument> latest = planVersionRepository.findFirstByProjectIdOrderByVersionNumberDesc(projectId);
            if (latest.isPresent()) {
                log.debug("Returning cached plan v{} for project {}", latest.get().getVersionNumber(), projectId);
                return toDto(latest.get());
            }
        }

        List<TaskDocument> tasks = taskRepository.findByProjectIdOrderByCreatedAtAsc(projectId);
        String prompt = promptBuilder.build(project, tasks);
        PlanContent content = modelInvoker.invoke(
                new CallContext(CallContext.PLANNING, projectId, userId),
                prompt,
                properties.getPlanning().toModelConfig(PlanPromptBuilder.SYSTEM_PROMPT),
                PlanContentShape.INSTANCE);

        PlanVersionDocument saved = insertNextVersion(projectId, userId, content);
        log.info("Generated plan v{} for project {}", saved.getVersionNumber(), projectId);
        return toDto(saved);
    }

    public Optional<PlanVersionDto> getLatestPlan(String projectId) {
        return planVersionRepository.findFirstByProjectIdOrderByVersionNumberDesc(projectId).map(this::toDto);
    }

    public List<PlanVersionDto> listVersions(String projectId) {
        return planVersionRepository.findByProjectIdOrderByVersionNumberDesc(projectId).stream()
                .map(this::toDto)
                .toList();
    }

    /** The unique (projectId, versionNumber) index turns a concurrent writer into a retry. */
    private PlanVersionDocument insertNextVersion(String projectId, String userId, PlanContent content) {
        DuplicateKeyException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_INSERT_ATTEMPTS; attempt++) {
            int next = planVersionRepository.findFirstByProjectIdOrderByVersionNumberDesc(projectId)
                    .map(PlanVersionDocument::getVersionNumber)
                    .orElse(0) + 1;
            PlanVersionDocument doc = new PlanVersionDocument();
            doc.setPlanVersionId(UUID.randomUUID().toString());
            doc.setProjectId(projectId);
            doc.setVersionNumber(next);
            doc.setContent(content);
            doc.setCreatedBy(userId);
            doc.setCreatedAt(clock.instant());
            try {
                return planVersionRepository.insert(doc);
            } catch (DuplicateKeyException e) {
                log.warn("Plan version {} for project {} taken by a concurrent writer, retrying", next, projectId);
                lastConflict = e;
            }
        }
        throw lastConflict;
    }

    private PlanVersionDto toDto(PlanVersionDocument doc) {
        return new PlanVersionDto(doc.getPlanVersionId(), doc.getProjectId(), doc.getVersionNumber(),
                doc.getContent(), doc.getCreatedBy(), doc.getCreatedAt());
    }
}
