package io.crewmesh.storage;

/**
 * Caller's verdict when finishing a task that went through review.
 */
public enum CompletionDecision {
    ACCEPT,
    REWORK
}
