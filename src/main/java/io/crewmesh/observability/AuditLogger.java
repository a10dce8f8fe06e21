package io.crewmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.crewmesh.config.CrewMeshConfig;
import io.crewmesh.storage.AdvisoryLock;
import io.crewmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL trail. Appends from several processes are serialized through the log's
 * advisory lock so lines never interleave.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final Duration lockTimeout;
    private final Clock clock;

    public AuditLogger(Path auditFile, Duration lockTimeout, Clock clock) {
        this.auditFile = auditFile;
        this.lockTimeout = lockTimeout;
        this.clock = clock;
    }

    public Path file() {
        return auditFile;
    }

    public void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now(clock).toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details());
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try (AdvisoryLock ignored = AdvisoryLock.acquire(CrewMeshConfig.lockFileFor(auditFile), lockTimeout)) {
            Files.createDirectories(auditFile.getParent());
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log: " + auditFile, e);
        }
    }

    /**
     * Last {@code limit} rows, oldest first.
     */
    public List<JsonNode> tail(int limit) {
        if (!Files.exists(auditFile)) {
            return List.of();
        }
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            List<JsonNode> rows = new ArrayList<>();
            for (int i = Math.max(0, lines.size() - Math.max(0, limit)); i < lines.size(); i++) {
                String line = lines.get(i);
                if (!line.isBlank()) {
                    rows.add(Jsons.mapper().readTree(line));
                }
            }
            return rows;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }
}
