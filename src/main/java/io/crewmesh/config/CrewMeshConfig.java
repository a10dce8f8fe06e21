package io.crewmesh.config;

import io.crewmesh.util.Ids;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class CrewMeshConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "crewmesh-settings.json";

    private final Path rootDir;

    public CrewMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static CrewMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new CrewMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public static Path lockFileFor(Path resource) {
        return resource.resolveSibling(resource.getFileName().toString() + ".lock");
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path queueDir() {
        return rootDir.resolve("queue");
    }

    public Path queueFile() {
        return queueDir().resolve("task-queue.json");
    }

    public Path queueLock() {
        return queueDir().resolve(".task-queue.lock");
    }

    public Path mailboxDir() {
        return rootDir.resolve("mailboxes");
    }

    public Path mailboxFile(String workerId) {
        return mailboxDir().resolve(Ids.requireSafe(workerId, "worker id") + ".jsonl");
    }

    public Path reputationDir() {
        return rootDir.resolve("reputation");
    }

    public Path reputationCache() {
        return reputationDir().resolve("reputation-cache.json");
    }

    public Path scoreLog() {
        return reputationDir().resolve("score-log.jsonl");
    }

    public Path reviewHistory() {
        return reputationDir().resolve("review-history.json");
    }

    public Path evolutionDir() {
        return rootDir.resolve("evolution");
    }

    public Path pendingDir() {
        return evolutionDir().resolve("pending");
    }

    public Path swapsDir() {
        return evolutionDir().resolve("swaps");
    }

    public Path votesDir() {
        return evolutionDir().resolve("votes");
    }

    public Path evolutionLog() {
        return evolutionDir().resolve("evolution-log.jsonl");
    }

    public Path overridesDir() {
        return rootDir.resolve("overrides");
    }

    public Path overridesFile(String workerId) {
        return overridesDir().resolve(Ids.requireSafe(workerId, "worker id") + ".md");
    }

    public Path logsDir() {
        return rootDir.resolve("logs");
    }
}
