package io.github.drompincen.planloop.runtime.daily;

import io.github.drompincen.planloop.persistence.document.TaskDocument;
import io.github.drompincen.planloop.protocol.api.TaskDto;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Picks up to three tasks for a day. Only TODO and IN_PROGRESS tasks are eligible; the
 * order is score descending, then earliest due date (undated last), then task id.
 */
@Component
public class DailyTaskSelector {

    public static final int MAX_TASKS = 3;

    static final Set<TaskDto.TaskStatus> ELIGIBLE = EnumSet.of(TaskDto.TaskStatus.TODO, TaskDto.TaskStatus.IN_PROGRESS);

    private static final Comparator<LocalDate> DUE_DATE = Comparator.nullsLast(Comparator.naturalOrder());
    private static final Comparator<String> TASK_ID = Comparator.nullsLast(Comparator.naturalOrder());

    private static final Comparator<ScoredTask> ORDER = Comparator
            .comparingInt(ScoredTask::score).reversed()
            .thenComparing((ScoredTask s) -> s.task().getDueDate(), DUE_DATE)
            .thenComparing((ScoredTask s) -> s.task().getTaskId(), TASK_ID);

    private final TaskScorer scorer;

    public DailyTaskSelector(TaskScorer scorer) {
        this.scorer = scorer;
    }

    public List<ScoredTask> select(Collection<TaskDocument> candidates, LocalDate asOf) {
        return candidates.stream()
                .filter(task -> ELIGIBLE.contains(task.getStatus()))
                .map(task -> new ScoredTask(task, scorer.score(task, asOf)))
                .sorted(ORDER)
                .limit(MAX_TASKS)
                .toList();
    }
}
