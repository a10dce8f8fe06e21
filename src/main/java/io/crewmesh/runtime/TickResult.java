package io.crewmesh.runtime;

public enum TickResult {
    /** A task was claimed and executed. */
    WORKED,
    /** Only review requests were handled. */
    REVIEWED,
    /** Nothing to do this cycle. */
    IDLE,
    /** A shutdown message arrived; the worker must stop. */
    SHUTDOWN
}
