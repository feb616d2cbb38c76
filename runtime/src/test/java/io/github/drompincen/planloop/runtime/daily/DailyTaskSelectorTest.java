package io.github.drompincen.planloop.runtime.daily;

import io.github.drompincen.planloop.persistence.document.TaskDocument;
import io.github.drompincen.planloop.protocol.api.TaskDto.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static io.github.drompincen.planloop.runtime.daily.TaskScorerTest.task;
import static org.assertj.core.api.Assertions.assertThat;

class DailyTaskSelectorTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    private final DailyTaskSelector selector = new DailyTaskSelector(new TaskScorer(ZoneOffset.UTC));

    @Test
    void picksAtMostThreeByScore() {
        List<TaskDocument> tasks = List.of(
                task("low", 1, TaskStatus.TODO, null, null),
                task("urgent", 10, TaskStatus.IN_PROGRESS, TODAY, null),
                task("high", 7, TaskStatus.TODO, null, null),
                task("medium", 4, TaskStatus.TODO, null, null),
                task("overdue", 4, TaskStatus.TODO, TODAY.minusDays(2), null));

        List<ScoredTask> selected = selector.select(tasks, TODAY);

        assertThat(selected).hasSize(DailyTaskSelector.MAX_TASKS);
        assertThat(selected).extracting(s -> s.task().getTaskId())
                .containsExactly("urgent", "overdue", "high");
        assertThat(selected).extracting(ScoredTask::score).containsExactly(95, 70, 30);
    }

    @Test
    void completedAndBlockedTasksAreNeverSelected() {
        List<TaskDocument> tasks = List.of(
                task("done", 10, TaskStatus.COMPLETED, TODAY, null),
                task("stuck", 10, TaskStatus.BLOCKED, TODAY, null),
                task("todo", 1, TaskStatus.TODO, null, null));

        assertThat(selector.select(tasks, TODAY)).extracting(s -> s.task().getTaskId())
                .containsExactly("todo");
    }

    @Test
    void tiesBreakOnDueDateThenTaskId() {
        // 20 + 10 = 30 for the dated ones; the undated HIGH task also lands on 30
        List<TaskDocument> tasks = List.of(
                task("b", 4, TaskStatus.TODO, TODAY.plusDays(12), null),
                task("z", 7, TaskStatus.TODO, null, null),
                task("c", 4, TaskStatus.TODO, TODAY.plusDays(9), null),
                task("a", 4, TaskStatus.TODO, TODAY.plusDays(12), null));

        assertThat(selector.select(tasks, TODAY)).extracting(s -> s.task().getTaskId())
                .containsExactly("c", "a", "b");
    }

    @Test
    void emptyWhenNothingEligible() {
        assertThat(selector.select(List.of(), TODAY)).isEmpty();
    }
}
