package io.github.drompincen.planloop.protocol.api;

import java.util.Locale;

/**
 * Scoring buckets for the numeric 0-10 task priority.
 * <p>
 * Tasks store priority as an integer. Buckets are 0-2 LOW, 3-5 MEDIUM, 6-8 HIGH and
 * 9-10 URGENT; out-of-range values are clamped first. Categorical labels coming back
 * from the model are converted with {@link #fromLabel(String)} and stored as the
 * bucket's {@link #representativeValue()}.
 */
public enum TaskPriority {
    LOW(10, 2),
    MEDIUM(20, 5),
    HIGH(30, 8),
    URGENT(40, 10);

    public static final int MIN_VALUE = 0;
    public static final int MAX_VALUE = 10;

    private final int baseScore;
    private final int representativeValue;

    TaskPriority(int baseScore, int representativeValue) {
        this.baseScore = baseScore;
        this.representativeValue = representativeValue;
    }

    public int baseScore() { return baseScore; }

    public int representativeValue() { return representativeValue; }

    public static TaskPriority fromValue(int value) {
        int clamped = clamp(value);
        if (clamped >= 9) return URGENT;
        if (clamped >= 6) return HIGH;
        if (clamped >= 3) return MEDIUM;
        return LOW;
    }

    /** Unknown or blank labels fall back to MEDIUM. Numeric strings are accepted too. */
    public static TaskPriority fromLabel(String label) {
        if (label == null || label.isBlank()) return MEDIUM;
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "urgent":
            case "critical":
                return URGENT;
            case "high":
                return HIGH;
            case "medium":
            case "normal":
                return MEDIUM;
            case "low":
                return LOW;
            default:
                try {
                    return fromValue((int) Math.round(Double.parseDouble(normalized)));
                } catch (NumberFormatException e) {
                    return MEDIUM;
                }
        }
    }

    public static int clamp(int value) {
        return Math.max(MIN_VALUE, Math.min(MAX_VALUE, value));
    }
}
