package io.crewmesh.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Review(
        @JsonProperty("reviewer") String reviewer,
        @JsonProperty("score") double score,
        @JsonProperty("comment") String comment,
        @JsonProperty("reviewed_at_ms") long reviewedAtMs
) {
}
