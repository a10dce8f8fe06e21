package io.crewmesh.evolution;

import io.crewmesh.config.CrewMeshConfig;
import io.crewmesh.storage.AdvisoryLock;
import io.crewmesh.storage.LockedJsonDocument;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-worker markdown file of corrective instructions appended to the worker's prompt.
 *
 * <p>The file is a sequence of {@code ## } headed blocks. Only the {@value #MAX_OVERRIDES} most
 * recent blocks are kept, and a block whose body is already present is not appended again.
 */
public final class PromptOverrides {
    public static final int MAX_OVERRIDES = 3;
    private static final String BLOCK_PREFIX = "## ";

    private final CrewMeshConfig config;
    private final Duration lockTimeout;
    private final Clock clock;

    public PromptOverrides(CrewMeshConfig config, Duration lockTimeout, Clock clock) {
        this.config = config;
        this.lockTimeout = lockTimeout;
        this.clock = clock;
    }

    /**
     * @return false when the same body is already present
     */
    public boolean append(String agentId, String title, String body) {
        Path file = config.overridesFile(agentId);
        String normalizedBody = body == null ? "" : body.strip();
        if (normalizedBody.isEmpty()) {
            return false;
        }
        try (AdvisoryLock ignored = AdvisoryLock.acquire(CrewMeshConfig.lockFileFor(file), lockTimeout)) {
            List<String> blocks = blocks(read(file));
            if (blocks.stream().anyMatch(block -> block.contains(normalizedBody))) {
                return false;
            }
            LocalDate day = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
            blocks.add(BLOCK_PREFIX + title + " (" + day + ")\n" + normalizedBody + "\n");
            if (blocks.size() > MAX_OVERRIDES) {
                blocks = new ArrayList<>(blocks.subList(blocks.size() - MAX_OVERRIDES, blocks.size()));
            }
            LockedJsonDocument.writeAtomically(file, String.join("\n", blocks));
            return true;
        }
    }

    public String read(String agentId) {
        return read(config.overridesFile(agentId));
    }

    public int blockCount(String agentId) {
        return blocks(read(agentId)).size();
    }

    /**
     * @return true when there was something to clear
     */
    public boolean clear(String agentId) {
        Path file = config.overridesFile(agentId);
        try (AdvisoryLock ignored = AdvisoryLock.acquire(CrewMeshConfig.lockFileFor(file), lockTimeout)) {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to clear overrides: " + file, e);
        }
    }

    private static String read(Path file) {
        if (!Files.exists(file)) {
            return "";
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read overrides: " + file, e);
        }
    }

    static List<String> blocks(String content) {
        List<String> blocks = new ArrayList<>();
        StringBuilder current = null;
        for (String line : content.split("\n", -1)) {
            if (line.startsWith(BLOCK_PREFIX)) {
                if (current != null) {
                    blocks.add(current.toString().strip() + "\n");
                }
                current = new StringBuilder();
            }
            if (current != null) {
                current.append(line).append('\n');
            }
        }
        if (current != null) {
            blocks.add(current.toString().strip() + "\n");
        }
        return blocks;
    }
}
