package io.github.drompincen.planloop.runtime.daily;

import io.github.drompincen.planloop.persistence.document.DailySummaryDocument;
import io.github.drompincen.planloop.persistence.document.TaskDocument;
import io.github.drompincen.planloop.persistence.repository.DailySummaryRepository;
import io.github.drompincen.planloop.persistence.repository.TaskRepository;
import io.github.drompincen.planloop.protocol.api.DailyPlanSummary;
import io.github.drompincen.planloop.protocol.api.DailySummaryDto;
import io.github.drompincen.planloop.protocol.api.TaskDto;
import io.github.drompincen.planloop.runtime.config.PlanloopProperties;
import io.github.drompincen.planloop.runtime.project.ProjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Persistence shell around {@link DailyTaskSelector}: one slot set per user and day,
 * generated once and then served from storage until explicitly regenerated.
 */
@Service
public class DailyPlanningService {

    private static final Logger log = LoggerFactory.getLogger(DailyPlanningService.class);

    private final TaskRepository taskRepository;
    private final DailySummaryRepository summaryRepository;
    private final DailyTaskSelector selector;
    private final SummaryTextFormatter formatter;
    private final Clock clock;
    private final ZoneId zone;

    public DailyPlanningService(TaskRepository taskRepository,
                                DailySummaryRepository summaryRepository,
                                DailyTaskSelector selector,
                                SummaryTextFormatter formatter,
                                PlanloopProperties properties,
                                Clock clock) {
        this.taskRepository = taskRepository;
        this.summaryRepository = summaryRepository;
        this.selector = selector;
        this.formatter = formatter;
        this.clock = clock;
        this.zone = properties.getDaily().getZone();
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }

    public List<DailySummaryDto> generateDailyPlan(String userId, LocalDate date, boolean regenerate) {
        LocalDate day = date != null ? date : today();
        if (regenerate) {
            summaryRepository.deleteByUserIdAndDate(userId, day);
            log.info("Discarded daily plan of user {} for {} before regenerating", userId, day);
        } else {
            List<DailySummaryDocument> existing = summaryRepository.findByUserIdAndDateOrderByRankAsc(userId, day);
            if (!existing.isEmpty()) {
                log.debug("Daily plan for user {} on {} already exists", userId, day);
                return toDtos(existing);
            }
        }

        List<TaskDocument> candidates = taskRepository.findByAssigneeIdAndStatusIn(userId, DailyTaskSelector.ELIGIBLE);
        List<ScoredTask> selected = selector.select(candidates, day);
        if (selected.isEmpty()) {
            log.info("No eligible tasks for daily plan of user {} on {}", userId, day);
            return List.of();
        }

        Instant now = clock.instant();
        List<DailySummaryDocument> rows = new ArrayList<>();
        int rank = 1;
        for (ScoredTask scored : selected) {
            DailySummaryDocument doc = new DailySummaryDocument();
            doc.setSummaryId(UUID.randomUUID().toString());
            doc.setUserId(userId);
            doc.setDate(day);
            doc.setTaskId(scored.task().getTaskId());
            doc.setRank(rank);
            doc.setSummaryText(formatter.format(rank, scored.task(), day));
            doc.setCompleted(false);
            doc.setCreatedAt(now);
            doc.setUpdatedAt(now);
            rows.add(doc);
            rank++;
        }

        try {
            List<DailySummaryDocument> saved = summaryRepository.insert(rows);
            log.info("Generated daily plan with {} task(s) for user {} on {}", saved.size(), userId, day);
            return toDtos(saved);
        } catch (DuplicateKeyException e) {
            // a concurrent request won; discard whatever part of our set got in and serve theirs
            log.info("Concurrent daily plan generation for user {} on {}, using the stored set", userId, day);
            List<String> ours = rows.stream().map(DailySummaryDocument::getSummaryId).toList();
            summaryRepository.deleteAllById(ours);
            return toDtos(summaryRepository.findByUserIdAndDateOrderByRankAsc(userId, day));
        }
    }

    public List<DailySummaryDto> getTodayPlan(String userId) {
        return generateDailyPlan(userId, today(), false);
    }

    /**
     * Completes the task and flags today's matching slot; the other slots are left alone.
     *
     * @throws IllegalArgumentException if the task does not exist or is not assigned to the user
     */
    public TaskDto markTaskComplete(String taskId, String userId, Double hoursWorked) {
        TaskDocument task = taskRepository.findById(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Task not found: " + taskId));
        if (!userId.equals(task.getAssigneeId())) {
            throw new IllegalArgumentException("Task " + taskId + " is not assigned to user " + userId);
        }
        Instant now = clock.instant();
        task.setStatus(TaskDto.TaskStatus.COMPLETED);
        task.setCompletedAt(now);
        task.setUpdatedAt(now);
        TaskDocument saved = taskRepository.save(task);

        summaryRepository.findFirstByUserIdAndDateAndTaskId(userId, today(), taskId).ifPresent(slot -> {
            slot.setCompleted(true);
            if (hoursWorked != null) {
                slot.setHoursWorked(hoursWorked);
            }
            slot.setSummaryText(formatter.markCompleted(slot.getSummaryText()));
            slot.setUpdatedAt(now);
            summaryRepository.save(slot);
        });
        log.info("Marked task {} complete for user {}", taskId, userId);
        return ProjectMapper.toDto(saved);
    }

    public DailyPlanSummary getPlanSummary(String userId, LocalDate date) {
        LocalDate day = date != null ? date : today();
        List<DailySummaryDocument> rows = summaryRepository.findByUserIdAndDateOrderByRankAsc(userId, day);
        int total = rows.size();
        int completed = (int) rows.stream().filter(DailySummaryDocument::isCompleted).count();
        double hours = rows.stream()
                .mapToDouble(r -> r.getHoursWorked() != null ? r.getHoursWorked() : 0.0)
                .sum();
        double rate = total > 0 ? completed * 100.0 / total : 0.0;
        List<DailyPlanSummary.Entry> entries = rows.stream()
                .map(r -> new DailyPlanSummary.Entry(r.getRank(), r.getTaskId(), r.getSummaryText(),
                        r.isCompleted(), r.getHoursWorked()))
                .toList();
        return new DailyPlanSummary(day, total, completed, rate, hours, entries);
    }

    private List<DailySummaryDto> toDtos(List<DailySummaryDocument> docs) {
        return docs.stream()
                .map(d -> new DailySummaryDto(d.getSummaryId(), d.getUserId(), d.getDate(), d.getTaskId(),
                        d.getRank(), d.getSummaryText(), d.isCompleted(), d.getHoursWorked(), d.getCreatedAt()))
                .toList();
    }
}
