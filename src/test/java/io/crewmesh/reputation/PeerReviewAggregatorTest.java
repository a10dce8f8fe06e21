package io.crewmesh.reputation;

import io.crewmesh.config.CrewMeshConfig;
import io.crewmesh.model.Review;
import io.crewmesh.testing.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static io.crewmesh.testing.TestRoots.deleteRecursively;

final class PeerReviewAggregatorTest {

    @Test
    void noReviewsPass() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-peer-empty-");
        try {
            PeerReviewAggregator peers = newAggregator(root);
            Assertions.assertEquals(100.0, peers.aggregate(List.of(), "author", Map.of()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reviewsWeighByReviewerReputation() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-peer-weight-");
        try {
            PeerReviewAggregator peers = newAggregator(root);
            List<Review> reviews = List.of(
                    new Review("trusted", 90.0, "", 1L),
                    new Review("shaky", 30.0, "", 2L));

            double aggregate = peers.aggregate(reviews, "author", Map.of("trusted", 90.0, "shaky", 30.0));
            Assertions.assertEquals(75.0, aggregate, 1e-9);
            Assertions.assertEquals(0.1, peers.computeWeight("newcomer", "author", 2.0), 1e-9);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void mutualInflationHalvesTheWeight() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-peer-mutual-");
        try {
            PeerReviewAggregator peers = newAggregator(root);
            for (int i = 0; i < 3; i++) {
                peers.recordReview("alice", "bob", 88.0);
                peers.recordReview("bob", "alice", 89.0);
            }
            Assertions.assertEquals(0.4, peers.computeWeight("alice", "bob", 80.0), 1e-9);
            Assertions.assertEquals(0.8, peers.computeWeight("alice", "carol", 80.0), 1e-9);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void extremeReviewersAreFlaggedAndDiscounted() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-peer-extreme-");
        try {
            PeerReviewAggregator peers = newAggregator(root);
            for (int i = 0; i < 5; i++) {
                peers.recordReview("harsh", "target-" + i, 0.0);
            }
            PeerReviewAggregator.ReviewerStats stats = peers.reviewerStats("harsh");
            Assertions.assertEquals(5, stats.totalReviews());
            Assertions.assertEquals(0.0, stats.averageScore());
            Assertions.assertTrue(stats.extremeBias());
            Assertions.assertEquals(0.6, peers.computeWeight("harsh", "someone", 100.0), 1e-9);

            PeerReviewAggregator.ReviewerStats none = peers.reviewerStats("quiet");
            Assertions.assertEquals(0, none.totalReviews());
            Assertions.assertFalse(none.extremeBias());
        } finally {
            deleteRecursively(root);
        }
    }

    private static PeerReviewAggregator newAggregator(Path root) {
        return new PeerReviewAggregator(CrewMeshConfig.fromRoot(root.toString()), Duration.ofSeconds(5),
                MutableClock.startingAt(1_000L));
    }
}
