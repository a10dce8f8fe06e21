package io.crewmesh.evolution;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ModelSwap(
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("new_model") String newModel,
        @JsonProperty("previous_model") String previousModel,
        @JsonProperty("reason") String reason,
        @JsonProperty("created_at_ms") long createdAtMs
) {
}
