package io.github.drompincen.planloop.runtime.planning;

import io.github.drompincen.planloop.runtime.config.PlanloopProperties;
import io.github.drompincen.planloop.runtime.llm.ModelUnavailableException;
import io.github.drompincen.planloop.runtime.worker.PipelineDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlanTriggerTest {

    @Mock
    private PlanningService planningService;

    @Mock
    private PipelineDispatcher dispatcher;

    private PlanloopProperties properties;
    private PlanTrigger trigger;

    @BeforeEach
    void setUp() {
        properties = new PlanloopProperties();
        trigger = new PlanTrigger(planningService, dispatcher, properties);
    }

    @Test
    void queuesGenerationForNewProject() {
        when(dispatcher.submit(anyString(), any(Runnable.class))).thenReturn(true);

        assertThat(trigger.onProjectCreated("proj-1", "alice", true)).isTrue();

        ArgumentCaptor<Runnable> work = ArgumentCaptor.forClass(Runnable.class);
        verify(dispatcher).submit(anyString(), work.capture());
        work.getValue().run();
        verify(planningService).generatePlan("proj-1", "alice", false);
    }

    @Test
    void generationFailureStaysInsideTheTask() {
        when(dispatcher.submit(anyString(), any(Runnable.class))).thenReturn(true);
        when(planningService.generatePlan("proj-1", "alice", false))
                .thenThrow(new ModelUnavailableException("no key"));

        trigger.onProjectCreated("proj-1", "alice", true);

        ArgumentCaptor<Runnable> work = ArgumentCaptor.forClass(Runnable.class);
        verify(dispatcher).submit(anyString(), work.capture());
        assertThatCode(() -> work.getValue().run()).doesNotThrowAnyException();
    }

    @Test
    void skippedWhenCallerOptsOut() {
        assertThat(trigger.onProjectCreated("proj-1", "alice", false)).isFalse();

        verifyNoInteractions(dispatcher, planningService);
    }

    @Test
    void skippedWhenDisabledByConfiguration() {
        properties.getPlanning().setAutoGenerate(false);

        assertThat(trigger.onProjectCreated("proj-1", "alice", true)).isFalse();

        verifyNoInteractions(dispatcher);
    }
}
