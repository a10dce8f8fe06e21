/**
 * Reputation scoring.
 *
 * <p>{@link io.crewmesh.reputation.ScoreAggregator} owns the persisted scores,
 * {@link io.crewmesh.reputation.ReputationScheduler} maps task events onto them and
 * {@link io.crewmesh.reputation.PeerReviewAggregator} weighs review verdicts.
 */
package io.crewmesh.reputation;
