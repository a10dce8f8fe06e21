package io.crewmesh.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RuntimeMode {
    PROCESS,
    IN_PROCESS,
    LAZY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RuntimeMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PROCESS;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("COOPERATIVE".equals(normalized)) {
            return IN_PROCESS;
        }
        try {
            return RuntimeMode.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown runtime mode: " + raw, e);
        }
    }
}
