package io.crewmesh.runtime;

import io.crewmesh.agent.ReviewRequest;
import io.crewmesh.agent.ReviewVerdict;
import io.crewmesh.agent.TaskReviewer;
import io.crewmesh.bus.Mailbox;
import io.crewmesh.config.ReputationSettings;
import io.crewmesh.model.MailboxMessage;
import io.crewmesh.model.MessageType;
import io.crewmesh.model.Review;
import io.crewmesh.model.Task;
import io.crewmesh.model.TaskStatus;
import io.crewmesh.reputation.PeerReviewAggregator;
import io.crewmesh.reputation.ReputationScheduler;
import io.crewmesh.reputation.ScoreAggregator;
import io.crewmesh.storage.CompletionDecision;
import io.crewmesh.storage.WorkQueue;
import io.crewmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Routes finished work to a peer reviewer and turns review verdicts into completion decisions.
 */
public final class ReviewCoordinator {
    private static final Logger LOG = LoggerFactory.getLogger(ReviewCoordinator.class);

    private final WorkQueue queue;
    private final Mailbox mailbox;
    private final ScoreAggregator scorer;
    private final ReputationScheduler scheduler;
    private final PeerReviewAggregator peerReviews;
    private final ReputationSettings settings;

    public ReviewCoordinator(
            WorkQueue queue,
            Mailbox mailbox,
            ScoreAggregator scorer,
            ReputationScheduler scheduler,
            PeerReviewAggregator peerReviews,
            ReputationSettings settings
    ) {
        this.queue = queue;
        this.mailbox = mailbox;
        this.scorer = scorer;
        this.scheduler = scheduler;
        this.peerReviews = peerReviews;
        this.settings = settings;
    }

    /**
     * Sends the task to one configured peer reviewer other than its author. Without peers the
     * task is completed directly.
     *
     * @return the chosen reviewer, if any
     */
    public Optional<String> requestReview(String authorId, Task task, String result) {
        List<String> peers = settings.peerReviewAgents().stream()
                .filter(peer -> !peer.equals(authorId))
                .toList();
        if (peers.isEmpty()) {
            queue.complete(task.id(), CompletionDecision.ACCEPT);
            LOG.info("[{}] completed {} without review", authorId, task.id());
            return Optional.empty();
        }
        String reviewer = peers.get(Math.floorMod(task.id().hashCode(), peers.size()));
        ReviewRequest request = new ReviewRequest(task.id(), authorId, task.description(), result);
        mailbox.send(reviewer, authorId, MessageType.REVIEW_REQUEST, Jsons.toCompactJson(request));
        LOG.info("[{}] sent {} to {} for review", authorId, task.id(), reviewer);
        return Optional.of(reviewer);
    }

    /**
     * Reviews a task still waiting in {@link TaskStatus#REVIEW}. Requests for tasks that moved
     * on (already reviewed, recovered, cancelled) are ignored, which makes redelivery harmless.
     */
    public Optional<CompletionDecision> handleReviewRequest(String reviewerId, TaskReviewer reviewer, MailboxMessage message) {
        ReviewRequest request;
        try {
            request = Jsons.fromJson(message.content(), ReviewRequest.class);
        } catch (RuntimeException e) {
            LOG.warn("[{}] unreadable review request from {}: {}", reviewerId, message.from(), e.getMessage());
            return Optional.empty();
        }
        Optional<Task> current = queue.get(request.taskId());
        if (current.isEmpty() || current.get().status() != TaskStatus.REVIEW) {
            LOG.debug("[{}] ignoring review request for {} (no longer in review)", reviewerId, request.taskId());
            return Optional.empty();
        }
        Task task = current.get();
        String authorId = task.agentId() != null ? task.agentId() : request.authorId();

        Optional<Review> earlier = task.reviews().stream()
                .filter(r -> reviewerId.equals(r.reviewer()))
                .filter(r -> task.claimedAtMs() == null || r.reviewedAtMs() >= task.claimedAtMs())
                .findFirst();
        if (earlier.isPresent()) {
            LOG.info("[{}] already reviewed {} ({}), deciding from the recorded score", reviewerId, task.id(),
                    earlier.get().score());
        } else if (!review(reviewerId, reviewer, request, task, authorId)) {
            return Optional.empty();
        }

        List<Review> attemptReviews = queue.get(task.id())
                .map(t -> t.reviews().stream()
                        .filter(r -> t.claimedAtMs() == null || r.reviewedAtMs() >= t.claimedAtMs())
                        .toList())
                .orElse(List.of());
        Map<String, Double> reputations = new HashMap<>();
        for (Review review : attemptReviews) {
            reputations.put(review.reviewer(), scorer.get(review.reviewer()));
        }
        double aggregate = peerReviews.aggregate(attemptReviews, authorId, reputations);
        CompletionDecision decision = aggregate >= settings.reviewPassScore()
                ? CompletionDecision.ACCEPT
                : CompletionDecision.REWORK;
        queue.complete(task.id(), decision);
        LOG.info("[{}] reviewed {} by {}: aggregate {} -> {}", reviewerId, task.id(), authorId,
                aggregate, decision.name().toLowerCase(Locale.ROOT));
        return Optional.of(decision);
    }

    private boolean review(String reviewerId, TaskReviewer reviewer, ReviewRequest request, Task task, String authorId) {
        ReviewVerdict verdict;
        try {
            verdict = reviewer.review(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            LOG.warn("[{}] review of {} failed: {}", reviewerId, task.id(), e.getMessage());
            return false;
        }
        queue.addReview(task.id(), reviewerId, verdict.score(), verdict.comment());
        peerReviews.recordReview(reviewerId, authorId, verdict.score());
        scheduler.onPeerReview(reviewerId, authorId, verdict.score());
        return true;
    }
}
