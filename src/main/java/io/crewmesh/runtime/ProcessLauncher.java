package io.crewmesh.runtime;

import io.crewmesh.config.WorkerDefinition;

import java.io.IOException;

@FunctionalInterface
public interface ProcessLauncher {
    Process launch(WorkerDefinition worker) throws IOException;
}
