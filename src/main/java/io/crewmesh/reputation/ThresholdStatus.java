package io.crewmesh.reputation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ThresholdStatus {
    HEALTHY,
    WATCH,
    WARNING,
    EVOLVE;

    public static final double HEALTHY_FLOOR = 80.0;
    public static final double WATCH_FLOOR = 60.0;
    public static final double WARNING_FLOOR = 40.0;

    public static ThresholdStatus of(double composite) {
        if (composite >= HEALTHY_FLOOR) {
            return HEALTHY;
        }
        if (composite >= WATCH_FLOOR) {
            return WATCH;
        }
        if (composite >= WARNING_FLOOR) {
            return WARNING;
        }
        return EVOLVE;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
