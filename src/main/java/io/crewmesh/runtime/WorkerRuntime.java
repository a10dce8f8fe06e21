package io.crewmesh.runtime;

import io.crewmesh.config.WorkerDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lifecycle of the worker fleet. Backends differ in what a running worker is: an OS process, a
 * task on a shared cooperative scheduler, or either of those started on demand.
 */
public sealed interface WorkerRuntime extends AutoCloseable
        permits ProcessWorkerRuntime, CooperativeWorkerRuntime, LazyWorkerRuntime {

    void start(WorkerDefinition worker);

    default void startAll(List<WorkerDefinition> workers) {
        for (WorkerDefinition worker : workers) {
            start(worker);
        }
    }

    boolean isAlive(String workerId);

    /**
     * Every worker this runtime knows about, running or not.
     */
    List<String> workerIds();

    default Map<String, Boolean> allAlive() {
        Map<String, Boolean> alive = new LinkedHashMap<>();
        for (String workerId : workerIds()) {
            alive.put(workerId, isAlive(workerId));
        }
        return alive;
    }

    void stop(String workerId);

    void stopAll();

    /**
     * Restarts {@code workerId} if it is not running. Backends that cannot restart throw
     * {@link IllegalStateException} for a dead worker.
     */
    default void ensureRunning(String workerId) {
        if (!isAlive(workerId)) {
            throw new IllegalStateException("worker " + workerId + " is not running and this runtime cannot restart it");
        }
    }

    /**
     * Forgets workers that exited on their own. Returns how many were dropped.
     */
    default int pruneDead() {
        return 0;
    }

    @Override
    default void close() {
        stopAll();
    }
}
