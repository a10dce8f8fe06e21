package io.crewmesh.evolution;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public record VoteOutcome(
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("status") Status status,
        @JsonProperty("votes_for") int votesFor,
        @JsonProperty("votes_against") int votesAgainst,
        @JsonProperty("quorum") int quorum,
        @JsonProperty("approval_ratio") double approvalRatio,
        @JsonProperty("threshold") double threshold
) {
    public enum Status {
        WAITING_FOR_QUORUM,
        APPROVED,
        REJECTED,
        ALREADY_VOTED,
        INELIGIBLE_VOTER,
        NO_PENDING_VOTE;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    static VoteOutcome of(String agentId, Status status) {
        return new VoteOutcome(agentId, status, 0, 0, 0, 0.0, 0.0);
    }
}
