/**
 * Self-correction of underperforming workers: diagnosis, prompt patches, operator-confirmed
 * model swaps and team-voted role restructures.
 */
package io.crewmesh.evolution;
