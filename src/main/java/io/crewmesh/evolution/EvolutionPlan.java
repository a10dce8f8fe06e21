package io.crewmesh.evolution;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record EvolutionPlan(
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("root_cause") String rootCause,
        @JsonProperty("error_patterns") List<String> errorPatterns,
        @JsonProperty("path") RemediationPath path,
        @JsonProperty("prompt_addition") String promptAddition,
        @JsonProperty("model_swap") ModelSwap modelSwap,
        @JsonProperty("role_proposal") String roleProposal,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("created_at_ms") long createdAtMs
) {
    public EvolutionPlan {
        errorPatterns = errorPatterns == null ? List.of() : List.copyOf(errorPatterns);
    }
}
