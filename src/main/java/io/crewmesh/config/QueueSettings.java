package io.crewmesh.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

public record QueueSettings(
        @JsonProperty("lease_timeout_ms") long leaseTimeoutMs,
        @JsonProperty("lock_timeout_ms") long lockTimeoutMs,
        @JsonProperty("recovery_interval_ms") long recoveryIntervalMs
) {
    public static final long DEFAULT_LEASE_TIMEOUT_MS = 600_000L;
    public static final long DEFAULT_LOCK_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_RECOVERY_INTERVAL_MS = 30_000L;

    public QueueSettings {
        leaseTimeoutMs = leaseTimeoutMs <= 0 ? DEFAULT_LEASE_TIMEOUT_MS : leaseTimeoutMs;
        lockTimeoutMs = lockTimeoutMs <= 0 ? DEFAULT_LOCK_TIMEOUT_MS : lockTimeoutMs;
        recoveryIntervalMs = recoveryIntervalMs <= 0 ? DEFAULT_RECOVERY_INTERVAL_MS : recoveryIntervalMs;
    }

    public static QueueSettings defaults() {
        return new QueueSettings(0L, 0L, 0L);
    }

    public Duration leaseTimeout() {
        return Duration.ofMillis(leaseTimeoutMs);
    }

    public Duration lockTimeout() {
        return Duration.ofMillis(lockTimeoutMs);
    }
}
