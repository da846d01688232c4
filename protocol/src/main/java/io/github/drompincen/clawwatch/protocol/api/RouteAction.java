package io.github.drompincen.clawwatch.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Handling decided for an event by the classifier.
 * {@link #UNKNOWN} stands for any action string the classifier made up.
 */
public enum RouteAction {
    CREATE_REMINDER("create_reminder"),
    SCHEDULE_TASK("schedule_task"),
    COMPLEX_ACTION("complex_action"),
    IGNORE("ignore"),
    UNKNOWN("unknown");

    private final String wireName;

    RouteAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static RouteAction fromWire(String value) {
        if (value == null) return UNKNOWN;
        String normalized = value.trim();
        for (RouteAction action : values()) {
            if (action != UNKNOWN && action.wireName.equalsIgnoreCase(normalized)) {
                return action;
            }
        }
        return UNKNOWN;
    }
}
