package io.crewmesh.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ReputationSettings(
        @JsonProperty("peer_review_agents") List<String> peerReviewAgents,
        @JsonProperty("role_vote_threshold") double roleVoteThreshold,
        @JsonProperty("review_pass_score") double reviewPassScore,
        @JsonProperty("min_claim_score") double minClaimScore,
        @JsonProperty("default_fallback_model") String defaultFallbackModel
) {
    public static final double DEFAULT_ROLE_VOTE_THRESHOLD = 0.6;
    public static final double DEFAULT_REVIEW_PASS_SCORE = 60.0;
    public static final String DEFAULT_FALLBACK_MODEL = "minimax-m2.5";

    public ReputationSettings {
        peerReviewAgents = peerReviewAgents == null ? List.of() : List.copyOf(peerReviewAgents);
        roleVoteThreshold = roleVoteThreshold <= 0 || roleVoteThreshold > 1 ? DEFAULT_ROLE_VOTE_THRESHOLD : roleVoteThreshold;
        reviewPassScore = reviewPassScore <= 0 ? DEFAULT_REVIEW_PASS_SCORE : reviewPassScore;
        minClaimScore = Math.max(0.0, minClaimScore);
        defaultFallbackModel = defaultFallbackModel == null || defaultFallbackModel.isBlank()
                ? DEFAULT_FALLBACK_MODEL
                : defaultFallbackModel.trim();
    }

    public static ReputationSettings defaults() {
        return new ReputationSettings(null, 0.0, 0.0, 0.0, null);
    }
}
