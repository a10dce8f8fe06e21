package io.crewmesh.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RuntimeSettings(
        @JsonProperty("mode") RuntimeMode mode,
        @JsonProperty("delegate") RuntimeMode delegate,
        @JsonProperty("always_on") List<String> alwaysOn,
        @JsonProperty("idle_shutdown_ms") long idleShutdownMs,
        @JsonProperty("idle_monitor_interval_ms") long idleMonitorIntervalMs,
        @JsonProperty("poll_interval_ms") long pollIntervalMs,
        @JsonProperty("grace_period_ms") long gracePeriodMs
) {
    public static final long DEFAULT_IDLE_SHUTDOWN_MS = 300_000L;
    public static final long DEFAULT_IDLE_MONITOR_INTERVAL_MS = 2_000L;
    public static final long DEFAULT_POLL_INTERVAL_MS = 1_000L;
    public static final long DEFAULT_GRACE_PERIOD_MS = 5_000L;

    public RuntimeSettings {
        mode = mode == null ? RuntimeMode.PROCESS : mode;
        delegate = delegate == null ? RuntimeMode.PROCESS : delegate;
        if (delegate == RuntimeMode.LAZY) {
            throw new IllegalArgumentException("lazy runtime cannot delegate to another lazy runtime");
        }
        alwaysOn = alwaysOn == null ? List.of() : List.copyOf(alwaysOn);
        idleShutdownMs = idleShutdownMs <= 0 ? DEFAULT_IDLE_SHUTDOWN_MS : idleShutdownMs;
        idleMonitorIntervalMs = idleMonitorIntervalMs <= 0 ? DEFAULT_IDLE_MONITOR_INTERVAL_MS : idleMonitorIntervalMs;
        pollIntervalMs = pollIntervalMs <= 0 ? DEFAULT_POLL_INTERVAL_MS : pollIntervalMs;
        gracePeriodMs = gracePeriodMs <= 0 ? DEFAULT_GRACE_PERIOD_MS : gracePeriodMs;
    }

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(null, null, null, 0L, 0L, 0L, 0L);
    }
}
