package io.github.drompincen.planloop.runtime.feedback;

import io.github.drompincen.planloop.persistence.document.FeedbackDocument;
import io.github.drompincen.planloop.persistence.document.TaskDocument;
import io.github.drompincen.planloop.persistence.repository.FeedbackRepository;
import io.github.drompincen.planloop.persistence.repository.ProjectRepository;
import io.github.drompincen.planloop.persistence.repository.TaskRepository;
import io.github.drompincen.planloop.protocol.api.AdjustmentDto;
import io.github.drompincen.planloop.protocol.api.AdjustmentType;
import io.github.drompincen.planloop.protocol.api.FeedbackDto;
import io.github.drompincen.planloop.protocol.api.FeedbackStatus;
import io.github.drompincen.planloop.protocol.api.FeedbackSubmissionResponse;
import io.github.drompincen.planloop.protocol.api.SubmitFeedbackRequest;
import io.github.drompincen.planloop.runtime.worker.PipelineDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeedbackServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T09:00:00Z");

    @Mock
    private FeedbackRepository feedbackRepository;

    @Mock
    private ProjectRepository projectRepository;

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private PipelineDispatcher dispatcher;

    private FeedbackService service;

    @BeforeEach
    void setUp() {
        service = new FeedbackService(feedbackRepository, projectRepository, taskRepository, dispatcher,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void submitStoresPendingAndDispatches() {
        when(projectRepository.existsById("proj-1")).thenReturn(true);
        when(dispatcher.dispatchFeedback(anyString())).thenReturn(true);

        FeedbackSubmissionResponse response = service.submit(
                new SubmitFeedbackRequest("proj-1", null, " ", "  The deadline is too tight  "));

        ArgumentCaptor<FeedbackDocument> captor = ArgumentCaptor.forClass(FeedbackDocument.class);
        verify(feedbackRepository).insert(captor.capture());
        FeedbackDocument stored = captor.getValue();
        assertThat(stored.getStatus()).isEqualTo(FeedbackStatus.PENDING);
        assertThat(stored.getUserName()).isEqualTo(FeedbackService.DEFAULT_USER_NAME);
        assertThat(stored.getFeedbackText()).isEqualTo("The deadline is too tight");
        assertThat(stored.getCreatedAt()).isEqualTo(NOW);
        assertThat(stored.getTaskId()).isNull();

        assertThat(response.feedbackId()).isEqualTo(stored.getFeedbackId());
        assertThat(response.status()).isEqualTo("pending");
        verify(dispatcher).dispatchFeedback(stored.getFeedbackId());
    }

    @Test
    void submitStillSucceedsWhenQueueIsFull() {
        when(projectRepository.existsById("proj-1")).thenReturn(true);
        when(dispatcher.dispatchFeedback(anyString())).thenReturn(false);

        FeedbackSubmissionResponse response = service.submit(
                new SubmitFeedbackRequest("proj-1", null, "bob", "text"));

        assertThat(response.status()).isEqualTo("pending");
        assertThat(response.message()).contains("worker is free");
    }

    @Test
    void emptyTextIsRejected() {
        assertThatThrownBy(() -> service.submit(new SubmitFeedbackRequest("proj-1", null, "bob", "   ")))
                .isInstanceOf(FeedbackValidationException.class);

        verify(feedbackRepository, never()).insert(any(FeedbackDocument.class));
    }

    @Test
    void unknownProjectIsRejected() {
        when(projectRepository.existsById("missing")).thenReturn(false);

        assertThatThrownBy(() -> service.submit(new SubmitFeedbackRequest("missing", null, "bob", "text")))
                .isInstanceOf(FeedbackValidationException.class)
                .hasMessageContaining("missing");

        verify(feedbackRepository, never()).insert(any(FeedbackDocument.class));
        verify(dispatcher, never()).dispatchFeedback(anyString());
    }

    @Test
    void taskFromAnotherProjectIsRejectedAndNothingStored() {
        TaskDocument foreign = new TaskDocument();
        foreign.setTaskId("task-9");
        foreign.setProjectId("proj-2");
        when(projectRepository.existsById("proj-1")).thenReturn(true);
        when(taskRepository.findById("task-9")).thenReturn(Optional.of(foreign));

        assertThatThrownBy(() -> service.submit(new SubmitFeedbackRequest("proj-1", "task-9", "bob", "text")))
                .isInstanceOf(FeedbackValidationException.class)
                .hasMessageContaining("does not belong");

        verify(feedbackRepository, never()).insert(any(FeedbackDocument.class));
    }

    @Test
    void unknownTaskIsRejected() {
        when(projectRepository.existsById("proj-1")).thenReturn(true);
        when(taskRepository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.submit(new SubmitFeedbackRequest("proj-1", "nope", "bob", "text")))
                .isInstanceOf(FeedbackValidationException.class);
    }

    @Test
    void adjustmentsHiddenUntilCompleted() {
        FeedbackDocument processing = feedback("fb-1", FeedbackStatus.PROCESSING);
        processing.setSummary("draft");
        processing.setAdjustments(List.of(adjustment("fb-1")));
        when(feedbackRepository.findById("fb-1")).thenReturn(Optional.of(processing));

        FeedbackDto dto = service.get("fb-1").orElseThrow();

        assertThat(dto.status()).isEqualTo(FeedbackStatus.PROCESSING);
        assertThat(dto.summary()).isNull();
        assertThat(dto.adjustments()).isEmpty();
    }

    @Test
    void completedFeedbackCarriesAdjustments() {
        FeedbackDocument completed = feedback("fb-2", FeedbackStatus.COMPLETED);
        completed.setSummary("Raise priority");
        completed.setAdjustments(List.of(adjustment("fb-2")));
        when(feedbackRepository.findByProjectIdAndStatusOrderByCreatedAtDesc("proj-1", FeedbackStatus.COMPLETED))
                .thenReturn(List.of(completed));

        List<FeedbackDto> list = service.list("proj-1", FeedbackStatus.COMPLETED);

        assertThat(list).singleElement().satisfies(dto -> {
            assertThat(dto.summary()).isEqualTo("Raise priority");
            assertThat(dto.adjustments()).hasSize(1);
        });
    }

    private static FeedbackDocument feedback(String id, FeedbackStatus status) {
        FeedbackDocument doc = new FeedbackDocument();
        doc.setFeedbackId(id);
        doc.setProjectId("proj-1");
        doc.setUserName("bob");
        doc.setFeedbackText("text");
        doc.setStatus(status);
        doc.setCreatedAt(NOW);
        return doc;
    }

    private static AdjustmentDto adjustment(String feedbackId) {
        return new AdjustmentDto("adj-1", feedbackId, AdjustmentType.TASK_PRIORITY, null,
                "Raise it", "5", "8", "urgent", NOW);
    }
}
