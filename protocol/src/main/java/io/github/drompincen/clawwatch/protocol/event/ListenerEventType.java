package io.github.drompincen.clawwatch.protocol.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ListenerEventType {
    NEW_EMAIL("new_email"),
    NEW_EVENT("new_event"),
    UPCOMING_EVENT("upcoming_event"),
    NEW_MESSAGE("new_message"),
    NOTIFICATION("notification"),
    CODE_REVIEW_REQUEST("code_review_request");

    private final String wireName;

    ListenerEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ListenerEventType fromWire(String value) {
        for (ListenerEventType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
