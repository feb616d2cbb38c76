package io.github.drompincen.planloop.persistence.repository;

import io.github.drompincen.planloop.protocol.api.AdjustmentDto;

import java.time.Instant;
import java.util.List;

/**
 * Conditional status transitions on feedback rows. Each method is a single
 * compare-and-set update and returns {@code true} only if this caller made the change.
 */
public interface FeedbackRepositoryCustom {

    /** PENDING to PROCESSING. Losing a concurrent claim returns false. */
    boolean claimForProcessing(String feedbackId, Instant now);

    /** PROCESSING to COMPLETED, writing summary and adjustments in the same update. */
    boolean completeWithAdjustments(String feedbackId, String summary, List<AdjustmentDto> adjustments, Instant now);

    /** PROCESSING to FAILED. Adjustments are never written on this path. */
    boolean markFailed(String feedbackId, String reason, Instant now);
}
