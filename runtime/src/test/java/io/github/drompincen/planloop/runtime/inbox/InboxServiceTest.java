package io.github.drompincen.planloop.runtime.inbox;

import io.github.drompincen.planloop.persistence.document.InboxItemDocument;
import io.github.drompincen.planloop.persistence.document.ProjectDocument;
import io.github.drompincen.planloop.persistence.document.TaskDocument;
import io.github.drompincen.planloop.persistence.repository.InboxItemRepository;
import io.github.drompincen.planloop.protocol.api.ClassificationAction;
import io.github.drompincen.planloop.protocol.api.InboxClassification;
import io.github.drompincen.planloop.protocol.api.InboxItemDto;
import io.github.drompincen.planloop.protocol.api.InboxItemDto.InboxStatus;
import io.github.drompincen.planloop.protocol.api.ModelConfig;
import io.github.drompincen.planloop.protocol.api.TaskDto.TaskStatus;
import io.github.drompincen.planloop.runtime.config.PlanloopProperties;
import io.github.drompincen.planloop.runtime.llm.CallContext;
import io.github.drompincen.planloop.runtime.llm.ModelInvoker;
import io.github.drompincen.planloop.runtime.llm.ModelTimeoutException;
import io.github.drompincen.planloop.runtime.parse.InboxClassificationShape;
import io.github.drompincen.planloop.runtime.planning.PlanTrigger;
import io.github.drompincen.planloop.runtime.project.ProjectService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InboxServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T09:00:00Z");

    @Mock
    private InboxItemRepository inboxItemRepository;

    @Mock
    private ProjectService projectService;

    @Mock
    private ModelInvoker modelInvoker;

    @Mock
    private PlanTrigger planTrigger;

    private InboxService service;

    @BeforeEach
    void setUp() {
        service = new InboxService(inboxItemRepository, projectService, modelInvoker, planTrigger,
                new PlanloopProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createItemStoresUnprocessed() {
        when(inboxItemRepository.insert(any(InboxItemDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        InboxItemDto dto = service.createItem("alice", "  Plan the offsite  ", List.of("team"));

        assertThat(dto.status()).isEqualTo(InboxStatus.UNPROCESSED);
        assertThat(dto.content()).isEqualTo("Plan the offsite");
        assertThat(dto.tags()).containsExactly("team");
        assertThat(dto.createdAt()).isEqualTo(NOW);
    }

    @Test
    void createItemRejectsBlankContent() {
        assertThatThrownBy(() -> service.createItem("alice", " ", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createTaskClassificationCreatesProjectAndTask() {
        givenClaimedItem();
        givenClassification(new InboxClassification(ClassificationAction.CREATE_TASK, "Offsite", "Team event",
                "Book venue", "Find a venue for 20", "high", null, null, "actionable"));
        when(projectService.insertProject("Offsite", "Team event", "alice")).thenReturn(project("proj-1"));
        TaskDocument task = new TaskDocument();
        task.setTaskId("task-1");
        when(projectService.insertTask("proj-1", "Book venue", "Find a venue for 20", TaskStatus.TODO, 8, "alice"))
                .thenReturn(task);
        when(inboxItemRepository.save(any(InboxItemDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        InboxItemDto dto = service.processItem("item-1", "alice", true);

        assertThat(dto.status()).isEqualTo(InboxStatus.PROCESSED);
        assertThat(dto.projectId()).isEqualTo("proj-1");
        assertThat(dto.taskId()).isEqualTo("task-1");
        assertThat(dto.classification().action()).isEqualTo(ClassificationAction.CREATE_TASK);
        verify(planTrigger).onProjectCreated("proj-1", "alice", true);
    }

    @Test
    void createProjectClassificationDefaultsName() {
        givenClaimedItem();
        givenClassification(new InboxClassification(ClassificationAction.CREATE_PROJECT, null, null,
                null, null, null, null, null, "big initiative"));
        when(projectService.insertProject(InboxService.UNTITLED_PROJECT, null, "alice")).thenReturn(project("proj-2"));
        when(inboxItemRepository.save(any(InboxItemDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        InboxItemDto dto = service.processItem("item-1", "alice", false);

        assertThat(dto.projectId()).isEqualTo("proj-2");
        assertThat(dto.taskId()).isNull();
        verify(planTrigger).onProjectCreated("proj-2", "alice", false);
    }

    @Test
    void createTaskWithoutProjectNameCreatesNothing() {
        givenClaimedItem();
        givenClassification(new InboxClassification(ClassificationAction.CREATE_TASK, null, null,
                "Call the bank", null, "low", null, null, null));
        when(inboxItemRepository.save(any(InboxItemDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        InboxItemDto dto = service.processItem("item-1", "alice", true);

        assertThat(dto.status()).isEqualTo(InboxStatus.PROCESSED);
        assertThat(dto.projectId()).isNull();
        verifyNoInteractions(projectService, planTrigger);
    }

    @Test
    void noActionOnlyRecordsClassification() {
        givenClaimedItem();
        givenClassification(InboxClassification.noAction("just a note"));
        when(inboxItemRepository.save(any(InboxItemDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        InboxItemDto dto = service.processItem("item-1", "alice", true);

        assertThat(dto.status()).isEqualTo(InboxStatus.PROCESSED);
        assertThat(dto.classification().reasoning()).isEqualTo("just a note");
        verifyNoInteractions(projectService);
    }

    @Test
    void modelFailureMarksItemFailed() {
        givenClaimedItem();
        when(modelInvoker.invoke(any(CallContext.class), anyString(), any(ModelConfig.class),
                eq(InboxClassificationShape.INSTANCE)))
                .thenThrow(new ModelTimeoutException("openai", Duration.ofSeconds(60)));
        when(inboxItemRepository.save(any(InboxItemDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        InboxItemDto dto = service.processItem("item-1", "alice", true);

        assertThat(dto.status()).isEqualTo(InboxStatus.FAILED);
        assertThat(dto.failureReason()).startsWith("Model call failed");
        verifyNoInteractions(projectService);
    }

    @Test
    void alreadyProcessedItemIsReturnedAsIs() {
        InboxItemDocument item = item();
        item.setStatus(InboxStatus.PROCESSED);
        when(inboxItemRepository.findById("item-1")).thenReturn(Optional.of(item));
        when(inboxItemRepository.claimForProcessing("item-1", "alice", NOW)).thenReturn(false);

        InboxItemDto dto = service.processItem("item-1", "alice", true);

        assertThat(dto.status()).isEqualTo(InboxStatus.PROCESSED);
        verifyNoInteractions(modelInvoker);
        verify(inboxItemRepository, never()).save(any(InboxItemDocument.class));
    }

    @Test
    void otherUsersItemIsRejected() {
        when(inboxItemRepository.findById("item-1")).thenReturn(Optional.of(item()));

        assertThatThrownBy(() -> service.processItem("item-1", "mallory", true))
                .isInstanceOf(IllegalArgumentException.class);
        verify(projectService, never()).insertTask(anyString(), anyString(), any(), any(), anyInt(), any());
        verify(planTrigger, never()).onProjectCreated(anyString(), anyString(), anyBoolean());
    }

    @Test
    void promptEmbedsItemContent() {
        assertThat(service.buildPrompt("Renew passport")).contains("Inbox item: \"Renew passport\"");
    }

    private void givenClaimedItem() {
        when(inboxItemRepository.findById("item-1")).thenReturn(Optional.of(item()));
        when(inboxItemRepository.claimForProcessing("item-1", "alice", NOW)).thenReturn(true);
    }

    private void givenClassification(InboxClassification classification) {
        when(modelInvoker.invoke(any(CallContext.class), anyString(), any(ModelConfig.class),
                eq(InboxClassificationShape.INSTANCE))).thenReturn(classification);
    }

    private static InboxItemDocument item() {
        InboxItemDocument doc = new InboxItemDocument();
        doc.setInboxItemId("item-1");
        doc.setUserId("alice");
        doc.setContent("Organize the team offsite");
        doc.setStatus(InboxStatus.UNPROCESSED);
        doc.setCreatedAt(NOW);
        return doc;
    }

    private static ProjectDocument project(String id) {
        ProjectDocument project = new ProjectDocument();
        project.setProjectId(id);
        return project;
    }
}
