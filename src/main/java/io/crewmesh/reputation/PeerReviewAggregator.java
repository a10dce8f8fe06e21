package io.crewmesh.reputation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import io.crewmesh.config.CrewMeshConfig;
import io.crewmesh.model.Review;
import io.crewmesh.storage.LockedJsonDocument;
import io.crewmesh.storage.LockedJsonDocument.Change;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted aggregation of peer review scores.
 *
 * <p>A review weighs as much as its reviewer's reputation, reduced when the reviewer and the
 * author keep trading high scores, when the reviewer drifts far from other reviewers of the same
 * authors, or when nearly all of its recent scores sit at the extremes.
 */
public final class PeerReviewAggregator {
    private static final Logger LOG = LoggerFactory.getLogger(PeerReviewAggregator.class);
    static final int PAIR_CAP = 50;
    static final int PER_AGENT_CAP = 100;
    static final int RECENT_WINDOW = 20;
    static final int MIN_REVIEWS_FOR_BIAS = 5;

    private final LockedJsonDocument<ReviewHistory> history;
    private final Clock clock;

    public PeerReviewAggregator(CrewMeshConfig config, Duration lockTimeout, Clock clock) {
        this.history = new LockedJsonDocument<>(
                config.reviewHistory(),
                CrewMeshConfig.lockFileFor(config.reviewHistory()),
                new TypeReference<ReviewHistory>() {
                },
                ReviewHistory::empty,
                lockTimeout
        );
        this.clock = clock;
    }

    public void recordReview(String reviewerId, String targetId, double score) {
        double bounded = Math.max(0.0, Math.min(100.0, score));
        long now = clock.millis();
        history.update(h -> {
            append(h.pairs(), reviewerId + "->" + targetId, new ScoredReview(reviewerId, targetId, bounded, now), PAIR_CAP);
            append(h.reviewers(), reviewerId, new ScoredReview(reviewerId, targetId, bounded, now), PER_AGENT_CAP);
            append(h.targets(), targetId, new ScoredReview(reviewerId, targetId, bounded, now), PER_AGENT_CAP);
            return Change.write(null);
        });
    }

    /**
     * Weighted mean of {@code reviews} of {@code targetId}'s work. Reviewers missing from
     * {@code reputations} count at the neutral score. No reviews pass with 100.
     */
    public double aggregate(List<Review> reviews, String targetId, Map<String, Double> reputations) {
        if (reviews == null || reviews.isEmpty()) {
            return 100.0;
        }
        ReviewHistory snapshot = history.read();
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (Review review : reviews) {
            double reputation = reputations.getOrDefault(review.reviewer(), ScoreAggregator.DEFAULT_SCORE);
            double weight = computeWeight(snapshot, review.reviewer(), targetId, reputation);
            weightedSum += review.score() * weight;
            totalWeight += weight;
        }
        return totalWeight == 0.0 ? 100.0 : weightedSum / totalWeight;
    }

    public double computeWeight(String reviewerId, String targetId, double reviewerReputation) {
        return computeWeight(history.read(), reviewerId, targetId, reviewerReputation);
    }

    public ReviewerStats reviewerStats(String reviewerId) {
        ReviewHistory snapshot = history.read();
        List<ScoredReview> reviews = snapshot.reviewers().getOrDefault(reviewerId, List.of());
        if (reviews.isEmpty()) {
            return new ReviewerStats(reviewerId, 0, 0.0, 0.0, 0.0, false);
        }
        double mean = reviews.stream().mapToDouble(ScoredReview::score).average().orElse(0.0);
        double variance = reviews.stream().mapToDouble(r -> (r.score() - mean) * (r.score() - mean)).sum()
                / Math.max(reviews.size() - 1, 1);
        return new ReviewerStats(
                reviewerId,
                reviews.size(),
                ScoreAggregator.round2(mean),
                ScoreAggregator.round2(Math.sqrt(variance)),
                ScoreAggregator.round2(consensusDeviation(snapshot, reviewerId)),
                extremeBias(snapshot, reviewerId)
        );
    }

    private double computeWeight(ReviewHistory snapshot, String reviewerId, String targetId, double reviewerReputation) {
        double weight = Math.max(0.1, reviewerReputation / 100.0);
        if (mutualInflation(snapshot, reviewerId, targetId)) {
            weight *= 0.5;
            LOG.warn("mutual score inflation between {} and {}", reviewerId, targetId);
        }
        double deviation = consensusDeviation(snapshot, reviewerId);
        if (deviation > 25.0) {
            weight *= 1.0 - Math.min(0.3, deviation / 100.0);
        }
        if (extremeBias(snapshot, reviewerId)) {
            weight *= 0.6;
        }
        return Math.max(0.05, weight);
    }

    private static boolean mutualInflation(ReviewHistory snapshot, String reviewerId, String targetId) {
        List<ScoredReview> forward = snapshot.pairs().getOrDefault(reviewerId + "->" + targetId, List.of());
        List<ScoredReview> backward = snapshot.pairs().getOrDefault(targetId + "->" + reviewerId, List.of());
        if (forward.size() < 3 || backward.size() < 3) {
            return false;
        }
        return average(forward) > 85.0 && average(backward) > 85.0;
    }

    private static double consensusDeviation(ReviewHistory snapshot, String reviewerId) {
        List<ScoredReview> reviews = snapshot.reviewers().getOrDefault(reviewerId, List.of());
        if (reviews.size() < MIN_REVIEWS_FOR_BIAS) {
            return 0.0;
        }
        List<Double> deviations = new ArrayList<>();
        for (ScoredReview review : recent(reviews)) {
            List<ScoredReview> others = snapshot.targets().getOrDefault(review.target(), List.of()).stream()
                    .filter(r -> !reviewerId.equals(r.reviewer()))
                    .toList();
            if (others.size() >= 2) {
                deviations.add(Math.abs(review.score() - average(others)));
            }
        }
        return deviations.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static boolean extremeBias(ReviewHistory snapshot, String reviewerId) {
        List<ScoredReview> reviews = snapshot.reviewers().getOrDefault(reviewerId, List.of());
        if (reviews.size() < MIN_REVIEWS_FOR_BIAS) {
            return false;
        }
        List<ScoredReview> window = recent(reviews);
        long extreme = window.stream().filter(r -> r.score() < 10.0 || r.score() > 90.0).count();
        return (double) extreme / window.size() > 0.7;
    }

    private static List<ScoredReview> recent(List<ScoredReview> reviews) {
        return reviews.subList(Math.max(0, reviews.size() - RECENT_WINDOW), reviews.size());
    }

    private static double average(List<ScoredReview> reviews) {
        return reviews.stream().mapToDouble(ScoredReview::score).average().orElse(0.0);
    }

    private static void append(Map<String, List<ScoredReview>> index, String key, ScoredReview review, int cap) {
        List<ScoredReview> list = new ArrayList<>(index.getOrDefault(key, List.of()));
        list.add(review);
        if (list.size() > cap) {
            list = new ArrayList<>(list.subList(list.size() - cap, list.size()));
        }
        index.put(key, list);
    }

    public record ScoredReview(
            @JsonProperty("reviewer") String reviewer,
            @JsonProperty("target") String target,
            @JsonProperty("score") double score,
            @JsonProperty("ts") long timestampMs
    ) {
    }

    public record ReviewHistory(
            @JsonProperty("pairs") Map<String, List<ScoredReview>> pairs,
            @JsonProperty("reviewers") Map<String, List<ScoredReview>> reviewers,
            @JsonProperty("targets") Map<String, List<ScoredReview>> targets
    ) {
        public ReviewHistory {
            pairs = pairs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(pairs);
            reviewers = reviewers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(reviewers);
            targets = targets == null ? new LinkedHashMap<>() : new LinkedHashMap<>(targets);
        }

        static ReviewHistory empty() {
            return new ReviewHistory(null, null, null);
        }
    }

    public record ReviewerStats(
            String reviewerId,
            int totalReviews,
            double averageScore,
            double scoreStddev,
            double consensusDeviation,
            boolean extremeBias
    ) {
    }
}
