package io.crewmesh.reputation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ReputationEntry(
        @JsonProperty("dimensions") Map<String, Double> dimensions,
        @JsonProperty("composite") double composite,
        @JsonProperty("history") List<CompositeSample> history,
        @JsonProperty("updated_at_ms") long updatedAtMs
) {
    public ReputationEntry {
        dimensions = dimensions == null ? Map.of() : Map.copyOf(dimensions);
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static ReputationEntry neutral(long nowMs) {
        Map<String, Double> dims = new LinkedHashMap<>();
        for (Dimension dimension : Dimension.values()) {
            dims.put(dimension.wireName(), ScoreAggregator.DEFAULT_SCORE);
        }
        return new ReputationEntry(dims, ScoreAggregator.DEFAULT_SCORE, List.of(), nowMs);
    }

    public double score(Dimension dimension) {
        return dimensions.getOrDefault(dimension.wireName(), ScoreAggregator.DEFAULT_SCORE);
    }

    ReputationEntry with(Dimension dimension, double value, int historyCap, long nowMs) {
        Map<String, Double> dims = new LinkedHashMap<>(dimensions);
        dims.put(dimension.wireName(), value);
        double nextComposite = ScoreAggregator.composite(dims);
        List<CompositeSample> samples = new ArrayList<>(history);
        samples.add(new CompositeSample(nextComposite, nowMs));
        if (samples.size() > historyCap) {
            samples = samples.subList(samples.size() - historyCap, samples.size());
        }
        return new ReputationEntry(dims, nextComposite, samples, nowMs);
    }

    public record CompositeSample(
            @JsonProperty("composite") double composite,
            @JsonProperty("ts") long timestampMs
    ) {
    }
}
