package io.crewmesh.reputation;

import io.crewmesh.model.TaskFlags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns task lifecycle events into reputation signals and reports the resulting threshold to a
 * {@link ThresholdListener}.
 */
public final class ReputationScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(ReputationScheduler.class);

    static final double FIRST_PASS_COMPLETION = 100.0;
    static final double REWORK_COMPLETION = 70.0;
    static final double FIRST_PASS_IMPROVEMENT = 70.0;
    static final double REWORK_IMPROVEMENT = 85.0;
    static final double ERROR_COMPLETION = 0.0;
    static final double ERROR_CONSISTENCY = 30.0;

    private final ScoreAggregator scorer;
    private final ThresholdListener listener;

    public ReputationScheduler(ScoreAggregator scorer, ThresholdListener listener) {
        this.scorer = scorer;
        this.listener = listener;
    }

    /**
     * A finished attempt. Work that carries a failure or lease-recovery flag is a rework: it
     * earns less completion credit but counts as improvement.
     */
    public ThresholdStatus onTaskComplete(String agentId, String taskId, String result, List<String> evolutionFlags) {
        boolean rework = TaskFlags.anyRework(evolutionFlags);
        scorer.update(agentId, Dimension.TASK_COMPLETION, rework ? REWORK_COMPLETION : FIRST_PASS_COMPLETION);
        scorer.update(agentId, Dimension.OUTPUT_QUALITY, OutputQualityHeuristic.score(result));
        scorer.update(agentId, Dimension.IMPROVEMENT_RATE, rework ? REWORK_IMPROVEMENT : FIRST_PASS_IMPROVEMENT);
        LOG.debug("[{}] scored completion of {} (rework={})", agentId, taskId, rework);
        return checkThreshold(agentId);
    }

    public ThresholdStatus onError(String agentId, String taskId, String error) {
        scorer.update(agentId, Dimension.TASK_COMPLETION, ERROR_COMPLETION);
        scorer.update(agentId, Dimension.CONSISTENCY, ERROR_CONSISTENCY);
        LOG.info("[{}] task {} failed: {}", agentId, taskId, error);
        return checkThreshold(agentId);
    }

    /**
     * Credits the reviewer for a plausible score and applies the score to the author's output
     * quality.
     */
    public void onPeerReview(String reviewerId, String authorId, double score) {
        scorer.update(reviewerId, Dimension.REVIEW_ACCURACY, reviewAccuracySignal(score));
        checkThreshold(reviewerId);
        if (authorId != null && !authorId.equals(reviewerId)) {
            scorer.update(authorId, Dimension.OUTPUT_QUALITY, score);
            checkThreshold(authorId);
        }
    }

    public ThresholdStatus checkThreshold(String agentId) {
        ThresholdStatus status = scorer.thresholdStatus(agentId);
        switch (status) {
            case HEALTHY -> listener.onHealthy(agentId);
            case WARNING, EVOLVE -> listener.onDegraded(agentId, status);
            case WATCH -> {
            }
        }
        return status;
    }

    static double reviewAccuracySignal(double score) {
        if (score >= 40.0 && score <= 80.0) {
            return 85.0;
        }
        if (score >= 20.0 && score <= 90.0) {
            return 70.0;
        }
        return 55.0;
    }
}
