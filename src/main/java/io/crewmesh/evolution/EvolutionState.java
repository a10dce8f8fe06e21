package io.crewmesh.evolution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Per-worker evolution state while a marker exists. No marker means no evolution in flight.
 */
public enum EvolutionState {
    DIAGNOSING,
    AWAITING_CONFIRMATION,
    AWAITING_VOTE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EvolutionState fromString(String raw) {
        try {
            return EvolutionState.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Unknown evolution state: " + raw, e);
        }
    }
}
