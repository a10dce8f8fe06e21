package io.crewmesh.runtime;

import io.crewmesh.config.WorkerDefinition;

@FunctionalInterface
public interface WorkerTickFactory {
    WorkerTick create(WorkerDefinition worker);
}
