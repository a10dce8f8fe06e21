package io.crewmesh.reputation;

import java.util.Locale;
import java.util.Optional;

/**
 * Scored dimensions and their weight in the composite. Weights sum to 1.
 */
public enum Dimension {
    TASK_COMPLETION(0.25),
    OUTPUT_QUALITY(0.30),
    IMPROVEMENT_RATE(0.25),
    CONSISTENCY(0.10),
    REVIEW_ACCURACY(0.10);

    private final double weight;

    Dimension(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Dimension> fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Dimension.valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
