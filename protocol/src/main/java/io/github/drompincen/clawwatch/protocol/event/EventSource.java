package io.github.drompincen.clawwatch.protocol.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a {@link ListenerEvent}. Serialized by its lowercase wire name.
 */
public enum EventSource {
    CALENDAR("calendar"),
    MAIL("mail"),
    MESSAGES("messages"),
    NOTIFICATIONS("notifications"),
    CODE_REVIEW("code_review");

    private final String wireName;

    EventSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EventSource fromWire(String value) {
        for (EventSource source : values()) {
            if (source.wireName.equalsIgnoreCase(value) || source.name().equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown event source: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
