package io.github.drompincen.planloop.runtime.feedback;

import io.github.drompincen.planloop.persistence.document.FeedbackDocument;
import io.github.drompincen.planloop.persistence.document.TaskDocument;
import io.github.drompincen.planloop.persistence.repository.FeedbackRepository;
import io.github.drompincen.planloop.persistence.repository.ProjectRepository;
import io.github.drompincen.planloop.persistence.repository.TaskRepository;
import io.github.drompincen.planloop.protocol.api.FeedbackDto;
import io.github.drompincen.planloop.protocol.api.FeedbackStatus;
import io.github.drompincen.planloop.protocol.api.FeedbackSubmissionResponse;
import io.github.drompincen.planloop.protocol.api.SubmitFeedbackRequest;
import io.github.drompincen.planloop.runtime.worker.PipelineDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Service
public class FeedbackService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

    static final String DEFAULT_USER_NAME = "anonymous";

    private final FeedbackRepository feedbackRepository;
    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;
    private final PipelineDispatcher dispatcher;
    private final Clock clock;

    public FeedbackService(FeedbackRepository feedbackRepository,
                           ProjectRepository projectRepository,
                           TaskRepository taskRepository,
                           PipelineDispatcher dispatcher,
                           Clock clock) {
        this.feedbackRepository = feedbackRepository;
        this.projectRepository = projectRepository;
        this.taskRepository = taskRepository;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    /**
     * Validates and stores the feedback as PENDING, then queues it for processing.
     *
     * @throws FeedbackValidationException if the project or task reference is invalid or the
     *                                     text is empty; nothing is stored in that case
     */
    public FeedbackSubmissionResponse submit(SubmitFeedbackRequest request) {
        validate(request);

        FeedbackDocument doc = new FeedbackDocument();
        doc.setFeedbackId(UUID.randomUUID().toString());
        doc.setProjectId(request.projectId());
        doc.setTaskId(blankToNull(request.taskId()));
        doc.setUserName(request.userName() == null || request.userName().isBlank()
                ? DEFAULT_USER_NAME : request.userName().trim());
        doc.setFeedbackText(request.feedbackText().trim());
        doc.setStatus(FeedbackStatus.PENDING);
        doc.setCreatedAt(clock.instant());
        feedbackRepository.insert(doc);
        log.info("Feedback {} submitted for project {}", doc.getFeedbackId(), doc.getProjectId());

        boolean queued = dispatcher.dispatchFeedback(doc.getFeedbackId());
        String message = queued
                ? "Feedback submitted and queued for processing"
                : "Feedback submitted; processing will start when a worker is free";
        return new FeedbackSubmissionResponse(doc.getFeedbackId(),
                FeedbackStatus.PENDING.name().toLowerCase(Locale.ROOT), message);
    }

    public Optional<FeedbackDto> get(String feedbackId) {
        return feedbackRepository.findById(feedbackId).map(FeedbackService::toDto);
    }

    public List<FeedbackDto> list(String projectId, FeedbackStatus status) {
        List<FeedbackDocument> docs;
        if (projectId != null && status != null) {
            docs = feedbackRepository.findByProjectIdAndStatusOrderByCreatedAtDesc(projectId, status);
        } else if (projectId != null) {
            docs = feedbackRepository.findByProjectIdOrderByCreatedAtDesc(projectId);
        } else if (status != null) {
            docs = feedbackRepository.findByStatusOrderByCreatedAtDesc(status);
        } else {
            docs = feedbackRepository.findAll();
        }
        return docs.stream().map(FeedbackService::toDto).toList();
    }

    private void validate(SubmitFeedbackRequest request) {
        if (request == null) {
            throw new FeedbackValidationException("Request body is required");
        }
        if (request.projectId() == null || request.projectId().isBlank()) {
            throw new FeedbackValidationException("projectId is required");
        }
        if (request.feedbackText() == null || request.feedbackText().isBlank()) {
            throw new FeedbackValidationException("feedbackText must not be empty");
        }
        if (!projectRepository.existsById(request.projectId())) {
            throw new FeedbackValidationException("Project not found: " + request.projectId());
        }
        String taskId = blankToNull(request.taskId());
        if (taskId != null) {
            TaskDocument task = taskRepository.findById(taskId)
                    .orElseThrow(() -> new FeedbackValidationException("Task not found: " + taskId));
            if (!request.projectId().equals(task.getProjectId())) {
                throw new FeedbackValidationException(
                        "Task " + taskId + " does not belong to project " + request.projectId());
            }
        }
    }

    /** Adjustments are only visible once the feedback is COMPLETED. */
    static FeedbackDto toDto(FeedbackDocument doc) {
        boolean completed = doc.getStatus() == FeedbackStatus.COMPLETED;
        return new FeedbackDto(
                doc.getFeedbackId(),
                doc.getProjectId(),
                doc.getTaskId(),
                doc.getUserName(),
                doc.getFeedbackText(),
                doc.getStatus(),
                completed ? doc.getSummary() : null,
                doc.getFailureReason(),
                doc.getCreatedAt(),
                doc.getProcessedAt(),
                completed && doc.getAdjustments() != null ? List.copyOf(doc.getAdjustments()) : List.of());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
