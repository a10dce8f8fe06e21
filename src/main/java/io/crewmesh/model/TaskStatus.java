package io.crewmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskStatus {
    PENDING,
    CLAIMED,
    REVIEW,
    COMPLETED,
    FAILED,
    BLOCKED,
    PAUSED,
    CANCELLED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Claimed or under review: owned by a worker and subject to lease expiry.
     */
    public boolean active() {
        return this == CLAIMED || this == REVIEW;
    }

    @JsonCreator
    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("task status cannot be empty");
        }
        try {
            return TaskStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown task status: " + raw, e);
        }
    }
}
