package io.crewmesh.runtime;

/**
 * One non-blocking cycle of a worker.
 */
@FunctionalInterface
public interface WorkerTick {
    TickResult tick();
}
