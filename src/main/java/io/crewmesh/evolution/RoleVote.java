package io.crewmesh.evolution;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public record RoleVote(
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("proposal") String proposal,
        @JsonProperty("votes_for") List<String> votesFor,
        @JsonProperty("votes_against") List<String> votesAgainst,
        @JsonProperty("created_at_ms") long createdAtMs
) {
    public RoleVote {
        votesFor = votesFor == null ? List.of() : List.copyOf(votesFor);
        votesAgainst = votesAgainst == null ? List.of() : List.copyOf(votesAgainst);
    }

    public boolean hasVoted(String voterId) {
        return votesFor.contains(voterId) || votesAgainst.contains(voterId);
    }

    public int totalVotes() {
        return votesFor.size() + votesAgainst.size();
    }

    RoleVote with(String voterId, boolean approve) {
        List<String> nextFor = new ArrayList<>(votesFor);
        List<String> nextAgainst = new ArrayList<>(votesAgainst);
        (approve ? nextFor : nextAgainst).add(voterId);
        return new RoleVote(agentId, proposal, nextFor, nextAgainst, createdAtMs);
    }
}
