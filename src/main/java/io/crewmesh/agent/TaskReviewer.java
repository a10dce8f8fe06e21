package io.crewmesh.agent;

@FunctionalInterface
public interface TaskReviewer {
    ReviewVerdict review(ReviewRequest request) throws Exception;
}
