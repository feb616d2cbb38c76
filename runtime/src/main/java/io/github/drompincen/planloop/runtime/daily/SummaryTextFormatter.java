package io.github.drompincen.planloop.runtime.daily;

import io.github.drompincen.planloop.persistence.document.TaskDocument;
import io.github.drompincen.planloop.protocol.api.TaskPriority;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Renders a slot line such as {@code #1 [URGENT] Fix login (DUE TODAY)}.
 */
@Component
public class SummaryTextFormatter {

    static final String COMPLETED_SUFFIX = " - COMPLETED";

    public String format(int rank, TaskDocument task, LocalDate asOf) {
        return "#" + rank + " [" + TaskPriority.fromValue(task.getPriority()) + "] " + task.getTitle()
                + dueInfo(task.getDueDate(), asOf);
    }

    public String markCompleted(String summaryText) {
        if (summaryText == null) return COMPLETED_SUFFIX.trim();
        return summaryText.endsWith(COMPLETED_SUFFIX) ? summaryText : summaryText + COMPLETED_SUFFIX;
    }

    static String dueInfo(LocalDate dueDate, LocalDate asOf) {
        if (dueDate == null) return "";
        long days = ChronoUnit.DAYS.between(asOf, dueDate);
        if (days < 0) return " (OVERDUE by " + (-days) + (days == -1 ? " day)" : " days)");
        if (days == 0) return " (DUE TODAY)";
        if (days <= 3) return " (Due in " + days + (days == 1 ? " day)" : " days)");
        return "";
    }
}
