package io.github.drompincen.planloop.runtime.feedback;

public enum ProcessingOutcome {
    /** Adjustments written and the row is COMPLETED. */
    COMPLETED,
    /** The row is FAILED with a reason and no adjustments. */
    FAILED,
    /** Another worker owns the row, or it was not pending; nothing was changed. */
    SKIPPED
}
