package io.github.drompincen.planloop.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ClassificationAction {
    CREATE_PROJECT("create_project"),
    CREATE_TASK("create_task"),
    ATTACH_TO_EXISTING("attach_to_existing"),
    NO_ACTION("no_action");

    private final String wireName;

    ClassificationAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    @JsonCreator
    public static ClassificationAction fromWire(String value) {
        if (value == null) return NO_ACTION;
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (ClassificationAction action : values()) {
            if (action.wireName.equals(normalized)) return action;
        }
        return NO_ACTION;
    }
}
