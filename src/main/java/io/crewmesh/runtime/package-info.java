/**
 * Worker execution.
 *
 * <p>{@link io.crewmesh.runtime.WorkerLoop} is the per-worker control flow,
 * {@link io.crewmesh.runtime.WorkerRuntime} and its backends decide where loops run, and
 * {@link io.crewmesh.runtime.CrewMeshRuntime} wires the components used by both.
 */
package io.crewmesh.runtime;
