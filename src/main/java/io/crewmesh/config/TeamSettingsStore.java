package io.crewmesh.config;

import io.crewmesh.storage.AdvisoryLock;
import io.crewmesh.storage.LockedJsonDocument;
import io.crewmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Reads {@code crewmesh-settings.json} and rewrites it for operator-approved model swaps.
 */
public final class TeamSettingsStore {
    private final Path settingsFile;

    public TeamSettingsStore(CrewMeshConfig config) {
        this.settingsFile = config.settingsFile();
    }

    public Path file() {
        return settingsFile;
    }

    public TeamSettings load() {
        if (!Files.exists(settingsFile)) {
            return TeamSettings.defaults();
        }
        try {
            String raw = Files.readString(settingsFile, StandardCharsets.UTF_8);
            if (raw.isBlank()) {
                return TeamSettings.defaults();
            }
            TeamSettings settings = Jsons.mapper().readValue(raw, TeamSettings.class);
            return settings == null ? TeamSettings.defaults() : settings;
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + settingsFile, e);
        }
    }

    public void save(TeamSettings settings) {
        Duration lockTimeout = settings.queue().lockTimeout();
        try (AdvisoryLock ignored = AdvisoryLock.acquire(CrewMeshConfig.lockFileFor(settingsFile), lockTimeout)) {
            LockedJsonDocument.writeAtomically(settingsFile, Jsons.toJson(settings));
        }
    }

    /**
     * Switches one worker to {@code model}. Returns the previous definition, or empty when the
     * worker is not configured.
     */
    public Optional<WorkerDefinition> updateWorkerModel(String workerId, String model) {
        TeamSettings current = load();
        Duration lockTimeout = current.queue().lockTimeout();
        try (AdvisoryLock ignored = AdvisoryLock.acquire(CrewMeshConfig.lockFileFor(settingsFile), lockTimeout)) {
            TeamSettings fresh = load();
            Optional<WorkerDefinition> previous = fresh.worker(workerId);
            if (previous.isEmpty()) {
                return Optional.empty();
            }
            TeamSettings updated = fresh.withWorker(previous.get().withModel(model));
            LockedJsonDocument.writeAtomically(settingsFile, Jsons.toJson(updated));
            return previous;
        }
    }
}
