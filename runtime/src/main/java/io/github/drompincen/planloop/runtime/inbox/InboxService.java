package io.github.drompincen.planloop.runtime.inbox;

import io.github.drompincen.planloop.persistence.document.InboxItemDocument;
import io.github.drompincen.planloop.persistence.document.ProjectDocument;
import io.github.drompincen.planloop.persistence.document.TaskDocument;
import io.github.drompincen.planloop.persistence.repository.InboxItemRepository;
import io.github.drompincen.planloop.protocol.api.ClassificationAction;
import io.github.drompincen.planloop.protocol.api.InboxClassification;
import io.github.drompincen.planloop.protocol.api.InboxItemDto;
import io.github.drompincen.planloop.protocol.api.TaskDto;
import io.github.drompincen.planloop.protocol.api.TaskPriority;
import io.github.drompincen.planloop.runtime.config.PlanloopProperties;
import io.github.drompincen.planloop.runtime.llm.CallContext;
import io.github.drompincen.planloop.runtime.llm.ModelInvoker;
import io.github.drompincen.planloop.runtime.parse.InboxClassificationShape;
import io.github.drompincen.planloop.runtime.planning.PlanTrigger;
import io.github.drompincen.planloop.runtime.project.ProjectService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Captures free-form notes and turns them into projects or tasks using a model
 * classification. Creating a project here can trigger plan generation.
 */
@Service
public class InboxService {

    private static final Logger log = LoggerFactory.getLogger(InboxService.class);

    public static final String SYSTEM_PROMPT = """
            You triage inbox items for a project tracker. Decide whether each item should become \
            a project, a task, be attached to existing work, or needs no action. Respond only with valid JSON.""";

    static final String UNTITLED_PROJECT = "Untitled Project";
    static final String UNTITLED_TASK = "Untitled Task";

    private final InboxItemRepository inboxItemRepository;
    private final ProjectService projectService;
    private final ModelInvoker modelInvoker;
    private final PlanTrigger planTrigger;
    private final PlanloopProperties properties;
    private final Clock clock;

    public InboxService(InboxItemRepository inboxItemRepository,
                        ProjectService projectService,
                        ModelInvoker modelInvoker,
                        PlanTrigger planTrigger,
                        PlanloopProperties properties,
                        Clock clock) {
        this.inboxItemRepository = inboxItemRepository;
        this.projectService = projectService;
        this.modelInvoker = modelInvoker;
        this.planTrigger = planTrigger;
        this.properties = properties;
        this.clock = clock;
    }

    public InboxItemDto createItem(String userId, String content, List<String> tags) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Inbox item content must not be empty");
        }
        Instant now = clock.instant();
        InboxItemDocument doc = new InboxItemDocument();
        doc.setInboxItemId(UUID.randomUUID().toString());
        doc.setUserId(userId);
        doc.setContent(content.trim());
        doc.setTags(tags != null ? List.copyOf(tags) : List.of());
        doc.setStatus(InboxItemDto.InboxStatus.UNPROCESSED);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        return toDto(inboxItemRepository.insert(doc));
    }

    public Optional<InboxItemDto> getItem(String inboxItemId) {
        return inboxItemRepository.findById(inboxItemId).map(InboxService::toDto);
    }

    public List<InboxItemDto> listItems(String userId, InboxItemDto.InboxStatus status) {
        List<InboxItemDocument> docs = status != null
                ? inboxItemRepository.findByUserIdAndStatusOrderByCreatedAtDesc(userId, status)
                : inboxItemRepository.findByUserIdOrderByCreatedAtDesc(userId);
        return docs.stream().map(InboxService::toDto).toList();
    }

    /**
     * Classifies an unprocessed item and acts on the classification. An item that is not
     * UNPROCESSED is returned unchanged.
     *
     * @throws IllegalArgumentException if the item does not exist or belongs to another user
     */
    public InboxItemDto processItem(String inboxItemId, String userId, boolean autoPlan) {
        InboxItemDocument item = inboxItemRepository.findById(inboxItemId)
                .orElseThrow(() -> new IllegalArgumentException("Inbox item not found: " + inboxItemId));
        if (!item.getUserId().equals(userId)) {
            throw new IllegalArgumentException("Inbox item " + inboxItemId + " does not belong to user " + userId);
        }
        if (!inboxItemRepository.claimForProcessing(inboxItemId, userId, clock.instant())) {
            log.info("Inbox item {} already processed or in progress", inboxItemId);
            return toDto(inboxItemRepository.findById(inboxItemId).orElse(item));
        }

        InboxClassification classification;
        try {
            classification = modelInvoker.invoke(
                    new CallContext(CallContext.INBOX, inboxItemId, userId),
                    buildPrompt(item.getContent()),
                    properties.getInbox().toModelConfig(SYSTEM_PROMPT),
                    InboxClassificationShape.INSTANCE);
        } catch (RuntimeException e) {
            log.error("Classification of inbox item {} failed: {}", inboxItemId, e.getMessage());
            item.setStatus(InboxItemDto.InboxStatus.FAILED);
            item.setFailureReason("Model call failed: " + e.getMessage());
            item.setUpdatedAt(clock.instant());
            return toDto(inboxItemRepository.save(item));
        }

        apply(item, classification, userId, autoPlan);
        item.setClassification(classification);
        item.setStatus(InboxItemDto.InboxStatus.PROCESSED);
        item.setUpdatedAt(clock.instant());
        InboxItemDocument saved = inboxItemRepository.save(item);
        log.info("Inbox item {} processed as {}", inboxItemId, classification.action().wireName());
        return toDto(saved);
    }

    private void apply(InboxItemDocument item, InboxClassification classification, String userId, boolean autoPlan) {
        ClassificationAction action = classification.action();
        if (action == ClassificationAction.CREATE_PROJECT) {
            ProjectDocument project = createProject(classification, userId, autoPlan,
                    orDefault(classification.projectName(), UNTITLED_PROJECT));
            item.setProjectId(project.getProjectId());
        } else if (action == ClassificationAction.CREATE_TASK) {
            if (classification.projectName() == null) {
                log.warn("Cannot create a task without a project for inbox item {}", item.getInboxItemId());
                return;
            }
            ProjectDocument project = createProject(classification, userId, autoPlan, classification.projectName());
            TaskDocument task = projectService.insertTask(
                    project.getProjectId(),
                    orDefault(classification.taskTitle(), UNTITLED_TASK),
                    classification.taskDescription(),
                    TaskDto.TaskStatus.TODO,
                    TaskPriority.fromLabel(classification.taskPriority()).representativeValue(),
                    userId);
            item.setProjectId(project.getProjectId());
            item.setTaskId(task.getTaskId());
        }
    }

    private ProjectDocument createProject(InboxClassification classification, String userId,
                                          boolean autoPlan, String name) {
        ProjectDocument project = projectService.insertProject(name, classification.projectDescription(), userId);
        planTrigger.onProjectCreated(project.getProjectId(), userId, autoPlan);
        return project;
    }

    String buildPrompt(String content) {
        return """
                Analyze the following inbox item and determine the best action to take.

                Inbox item: "%s"

                Respond with a JSON object with the following structure:
                {
                    "action": "create_project" | "create_task" | "attach_to_existing" | "no_action",
                    "project_name": "optional project name if action is create_project or create_task",
                    "project_description": "optional project description",
                    "task_title": "optional task title if action is create_task",
                    "task_description": "optional task description",
                    "task_priority": "low" | "medium" | "high" | "urgent",
                    "reasoning": "brief explanation of your decision"
                }

                Guidelines:
                - Use "create_project" if the item describes a large initiative or goal
                - Use "create_task" if the item is a specific actionable task
                - Use "no_action" if the item is just a note or doesn't require action
                - Keep names and descriptions concise and clear
                - Infer appropriate priority based on urgency indicators in the text

                Respond only with valid JSON, no additional text.""".formatted(content);
    }

    static InboxItemDto toDto(InboxItemDocument doc) {
        return new InboxItemDto(doc.getInboxItemId(), doc.getUserId(), doc.getContent(),
                doc.getTags() != null ? doc.getTags() : List.of(), doc.getStatus(), doc.getClassification(),
                doc.getProjectId(), doc.getTaskId(), doc.getFailureReason(), doc.getCreatedAt(), doc.getUpdatedAt());
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
