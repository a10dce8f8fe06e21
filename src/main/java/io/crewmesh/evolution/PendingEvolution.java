package io.crewmesh.evolution;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PendingEvolution(
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("state") EvolutionState state,
        @JsonProperty("path") RemediationPath path,
        @JsonProperty("created_at_ms") long createdAtMs
) {
    PendingEvolution advance(EvolutionState next, RemediationPath chosen) {
        return new PendingEvolution(agentId, next, chosen, createdAtMs);
    }
}
