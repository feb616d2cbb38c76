package io.github.drompincen.planloop.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AdjustmentType {
    TASK_PRIORITY("task_priority"),
    TASK_DESCRIPTION("task_description"),
    TASK_STATUS("task_status"),
    NEW_TASK("new_task"),
    REMOVE_TASK("remove_task"),
    TASK_ESTIMATE("task_estimate"),
    GENERAL("general");

    private final String wireName;

    AdjustmentType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    /** Lenient lookup: accepts wire names or constant names, anything else is GENERAL. */
    @JsonCreator
    public static AdjustmentType fromWire(String value) {
        if (value == null) return GENERAL;
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (AdjustmentType type : values()) {
            if (type.wireName.equals(normalized)) return type;
        }
        return GENERAL;
    }
}
