package io.crewmesh.evolution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RemediationPath {
    /** Append corrective instructions to the worker's prompt overrides. Applied immediately. */
    PROMPT,
    /** Switch the worker to a fallback model. Needs operator confirmation. */
    MODEL,
    /** Narrow the worker's scope. Needs a team vote. */
    ROLE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RemediationPath fromString(String raw) {
        try {
            return RemediationPath.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Unknown remediation path: " + raw, e);
        }
    }
}
