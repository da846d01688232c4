package io.github.drompincen.clawwatch.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Priority {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String wireName;

    Priority(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Missing or unrecognized values are treated as {@link #MEDIUM}. */
    public static Priority fromWire(String value) {
        if (value != null) {
            for (Priority p : values()) {
                if (p.wireName.equalsIgnoreCase(value.trim())) return p;
            }
        }
        return MEDIUM;
    }
}
