package io.crewmesh.agent;

import io.crewmesh.reputation.OutputQualityHeuristic;

public final class HeuristicTaskReviewer implements TaskReviewer {
    @Override
    public ReviewVerdict review(ReviewRequest request) {
        double score = OutputQualityHeuristic.score(request.result());
        return new ReviewVerdict(score, "heuristic review");
    }
}
