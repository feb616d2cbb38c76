package io.github.drompincen.planloop.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One ranked slot of a user's daily top-3. The unique (userId, date, rank) index is what
 * keeps concurrent generation for the same day from producing two slot sets.
 */
@Document(collection = "daily_summaries")
@CompoundIndex(name = "user_date_rank", def = "{'userId': 1, 'date': 1, 'rank': 1}", unique = true)
public class DailySummaryDocument {

    @Id
    private String summaryId;
    private String userId;
    private LocalDate date;
    private String taskId;
    private int rank;
    private String summaryText;
    private boolean completed;
    private Double hoursWorked;
    private Instant createdAt;
    private Instant updatedAt;

    public DailySummaryDocument() {}

    public String getSummaryId() { return summaryId; }
    public void setSummaryId(String summaryId) { this.summaryId = summaryId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public int getRank() { return rank; }
    public void setRank(int rank) { this.rank = rank; }

    public String getSummaryText() { return summaryText; }
    public void setSummaryText(String summaryText) { this.summaryText = summaryText; }

    public boolean isCompleted() { return completed; }
    public void setCompleted(boolean completed) { this.completed = completed; }

    public Double getHoursWorked() { return hoursWorked; }
    public void setHoursWorked(Double hoursWorked) { this.hoursWorked = hoursWorked; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
