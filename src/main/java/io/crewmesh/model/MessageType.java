package io.crewmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageType {
    SHUTDOWN,
    REVIEW_REQUEST,
    MESSAGE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Unknown types from newer senders degrade to plain messages instead of poisoning the drain.
     */
    @JsonCreator
    public static MessageType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MESSAGE;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (MessageType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return MESSAGE;
    }
}
