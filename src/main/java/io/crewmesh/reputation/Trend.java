package io.crewmesh.reputation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public enum Trend {
    IMPROVING,
    STABLE,
    DECLINING;

    static final int WINDOW = 10;
    static final int MIN_SAMPLES = 4;
    static final double DELTA = 3.0;

    /**
     * Compares the mean of the newer half of the last {@value #WINDOW} composites against the
     * older half.
     */
    public static Trend of(List<Double> composites) {
        if (composites.size() < MIN_SAMPLES) {
            return STABLE;
        }
        List<Double> recent = composites.subList(Math.max(0, composites.size() - WINDOW), composites.size());
        int mid = recent.size() / 2;
        double older = recent.subList(0, mid).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double newer = recent.subList(mid, recent.size()).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double delta = newer - older;
        if (delta > DELTA) {
            return IMPROVING;
        }
        if (delta < -DELTA) {
            return DECLINING;
        }
        return STABLE;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
