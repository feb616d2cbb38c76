package io.github.drompincen.planloop.runtime.parse;

import java.util.List;

/**
 * Parsed feedback response. Always carries at least one adjustment.
 */
public record FeedbackAnalysis(String summary, List<ParsedAdjustment> adjustments) {

    public FeedbackAnalysis {
        adjustments = List.copyOf(adjustments);
    }
}
