package io.crewmesh.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.crewmesh.util.Ids;

import java.util.List;

public record WorkerDefinition(
        @JsonProperty("id") String id,
        @JsonProperty("role") String role,
        @JsonProperty("model") String model,
        @JsonProperty("fallback_models") List<String> fallbackModels,
        @JsonProperty("executor") String executor,
        @JsonProperty("command") List<String> command,
        @JsonProperty("timeout_ms") long timeoutMs
) {
    public static final String DEFAULT_EXECUTOR = "echo";
    public static final long DEFAULT_TIMEOUT_MS = 120_000L;

    public WorkerDefinition {
        Ids.requireSafe(id, "worker id");
        role = role == null ? "" : role.trim();
        model = model == null ? "" : model.trim();
        fallbackModels = fallbackModels == null ? List.of() : List.copyOf(fallbackModels);
        executor = executor == null || executor.isBlank() ? DEFAULT_EXECUTOR : executor.trim();
        command = command == null ? List.of() : List.copyOf(command);
        timeoutMs = timeoutMs <= 0 ? DEFAULT_TIMEOUT_MS : timeoutMs;
    }

    public static WorkerDefinition of(String id, String role) {
        return new WorkerDefinition(id, role, null, null, null, null, 0L);
    }

    public WorkerDefinition withModel(String nextModel) {
        return new WorkerDefinition(id, role, nextModel, fallbackModels, executor, command, timeoutMs);
    }
}
