package io.crewmesh.reputation;

import com.fasterxml.jackson.core.type.TypeReference;
import io.crewmesh.config.CrewMeshConfig;
import io.crewmesh.observability.AuditLogger;
import io.crewmesh.storage.LockedJsonDocument;
import io.crewmesh.storage.LockedJsonDocument.Change;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Five-dimension reputation kept as exponential moving averages.
 *
 * <p>Each update blends the new signal into one dimension
 * ({@code 0.3 * signal + 0.7 * previous}), recomputes the weighted composite, appends it to a
 * bounded history and writes an audit row to {@code score-log.jsonl}. Unknown workers start at a
 * neutral {@value #DEFAULT_SCORE} in every dimension.
 */
public final class ScoreAggregator {
    public static final double ALPHA = 0.3;
    public static final double DEFAULT_SCORE = 70.0;
    public static final int HISTORY_CAP = 50;

    private final LockedJsonDocument<LinkedHashMap<String, ReputationEntry>> cache;
    private final AuditLogger scoreLog;
    private final Clock clock;

    public ScoreAggregator(CrewMeshConfig config, Duration lockTimeout, Clock clock) {
        this.cache = new LockedJsonDocument<>(
                config.reputationCache(),
                CrewMeshConfig.lockFileFor(config.reputationCache()),
                new TypeReference<LinkedHashMap<String, ReputationEntry>>() {
                },
                LinkedHashMap::new,
                lockTimeout
        );
        this.scoreLog = new AuditLogger(config.scoreLog(), lockTimeout, clock);
        this.clock = clock;
    }

    public ReputationEntry update(String agentId, Dimension dimension, double signal) {
        double bounded = Math.max(0.0, Math.min(100.0, signal));
        ReputationEntry updated = cache.update(entries -> {
            long now = clock.millis();
            ReputationEntry current = entries.getOrDefault(agentId, ReputationEntry.neutral(now));
            double blended = round2(ALPHA * bounded + (1.0 - ALPHA) * current.score(dimension));
            ReputationEntry next = current.with(dimension, blended, HISTORY_CAP, now);
            entries.put(agentId, next);
            return Change.write(next);
        });
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("dimension", dimension.wireName());
        details.put("signal", bounded);
        details.put("value", updated.score(dimension));
        details.put("composite", updated.composite());
        scoreLog.log(AuditLogger.AuditEvent.of("reputation.update", "scorer", agentId, "ok", details));
        return updated;
    }

    public double get(String agentId) {
        return entry(agentId).map(ReputationEntry::composite).orElse(DEFAULT_SCORE);
    }

    public Map<Dimension, Double> getAll(String agentId) {
        ReputationEntry entry = entry(agentId).orElseGet(() -> ReputationEntry.neutral(clock.millis()));
        Map<Dimension, Double> scores = new EnumMap<>(Dimension.class);
        for (Dimension dimension : Dimension.values()) {
            scores.put(dimension, entry.score(dimension));
        }
        return scores;
    }

    public double get(String agentId, Dimension dimension) {
        return entry(agentId).map(e -> e.score(dimension)).orElse(DEFAULT_SCORE);
    }

    public Optional<ReputationEntry> entry(String agentId) {
        return Optional.ofNullable(cache.read().get(agentId));
    }

    public Map<String, ReputationEntry> entries() {
        return Map.copyOf(cache.read());
    }

    public Trend trend(String agentId) {
        List<Double> composites = entry(agentId)
                .map(e -> e.history().stream().map(ReputationEntry.CompositeSample::composite).toList())
                .orElse(List.of());
        return Trend.of(composites);
    }

    public ThresholdStatus thresholdStatus(String agentId) {
        return ThresholdStatus.of(get(agentId));
    }

    public AuditLogger scoreLog() {
        return scoreLog;
    }

    static double composite(Map<String, Double> dimensions) {
        double sum = 0.0;
        for (Dimension dimension : Dimension.values()) {
            sum += dimension.weight() * dimensions.getOrDefault(dimension.wireName(), DEFAULT_SCORE);
        }
        return round2(sum);
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
