package io.crewmesh.reputation;

/**
 * Receives threshold outcomes after every reputation update.
 */
public interface ThresholdListener {
    void onHealthy(String agentId);

    void onDegraded(String agentId, ThresholdStatus status);
}
