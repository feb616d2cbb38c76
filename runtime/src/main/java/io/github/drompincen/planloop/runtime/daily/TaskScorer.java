package io.github.drompincen.planloop.runtime.daily;

import io.github.drompincen.planloop.persistence.document.TaskDocument;
import io.github.drompincen.planloop.protocol.api.TaskDto;
import io.github.drompincen.planloop.protocol.api.TaskPriority;
import io.github.drompincen.planloop.runtime.config.PlanloopProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;

/**
 * Daily priority score of a task as of a calendar day. Pure: depends only on the task's
 * priority, status, due date and creation date.
 * <p>
 * Total is the sum of: priority base (urgent 40, high 30, medium 20, low 10), +15 when in
 * progress, a due-date bonus (overdue 50, today 40, 1-3 days 30, 4-7 days 20, 8-14 days 10)
 * and +5 for tasks created at least 30 days earlier.
 */
@Component
public class TaskScorer {

    static final int IN_PROGRESS_BONUS = 15;
    static final int AGE_BONUS = 5;
    static final int AGE_THRESHOLD_DAYS = 30;

    private final ZoneId zone;

    @Autowired
    public TaskScorer(PlanloopProperties properties) {
        this(properties.getDaily().getZone());
    }

    public TaskScorer(ZoneId zone) {
        this.zone = zone;
    }

    public int score(TaskDocument task, LocalDate asOf) {
        return priorityScore(task)
                + statusBonus(task)
                + dueDateBonus(task.getDueDate(), asOf)
                + ageBonus(task, asOf);
    }

    int priorityScore(TaskDocument task) {
        return TaskPriority.fromValue(task.getPriority()).baseScore();
    }

    int statusBonus(TaskDocument task) {
        return task.getStatus() == TaskDto.TaskStatus.IN_PROGRESS ? IN_PROGRESS_BONUS : 0;
    }

    static int dueDateBonus(LocalDate dueDate, LocalDate asOf) {
        if (dueDate == null) return 0;
        long days = ChronoUnit.DAYS.between(asOf, dueDate);
        if (days < 0) return 50;
        if (days == 0) return 40;
        if (days <= 3) return 30;
        if (days <= 7) return 20;
        if (days <= 14) return 10;
        return 0;
    }

    int ageBonus(TaskDocument task, LocalDate asOf) {
        if (task.getCreatedAt() == null) return 0;
        LocalDate created = task.getCreatedAt().atZone(zone).toLocalDate();
        return ChronoUnit.DAYS.between(created, asOf) >= AGE_THRESHOLD_DAYS ? AGE_BONUS : 0;
    }
}
