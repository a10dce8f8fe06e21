package io.crewmesh.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Contents of {@code crewmesh-settings.json}. Missing sections fall back to defaults.
 */
public record TeamSettings(
        @JsonProperty("runtime") RuntimeSettings runtime,
        @JsonProperty("queue") QueueSettings queue,
        @JsonProperty("reputation") ReputationSettings reputation,
        @JsonProperty("workers") List<WorkerDefinition> workers
) {
    public TeamSettings {
        runtime = runtime == null ? RuntimeSettings.defaults() : runtime;
        queue = queue == null ? QueueSettings.defaults() : queue;
        reputation = reputation == null ? ReputationSettings.defaults() : reputation;
        workers = workers == null ? List.of() : List.copyOf(workers);
        Set<String> seen = new HashSet<>();
        for (WorkerDefinition worker : workers) {
            if (!seen.add(worker.id())) {
                throw new IllegalArgumentException("duplicate worker id: " + worker.id());
            }
        }
    }

    public static TeamSettings defaults() {
        return new TeamSettings(null, null, null, null);
    }

    public Optional<WorkerDefinition> worker(String workerId) {
        return workers.stream().filter(w -> w.id().equals(workerId)).findFirst();
    }

    public int teamSize() {
        return workers.size();
    }

    public TeamSettings withWorker(WorkerDefinition updated) {
        List<WorkerDefinition> next = new ArrayList<>(workers.size());
        boolean replaced = false;
        for (WorkerDefinition worker : workers) {
            if (worker.id().equals(updated.id())) {
                next.add(updated);
                replaced = true;
            } else {
                next.add(worker);
            }
        }
        if (!replaced) {
            next.add(updated);
        }
        return new TeamSettings(runtime, queue, reputation, next);
    }
}
