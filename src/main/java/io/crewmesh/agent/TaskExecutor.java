package io.crewmesh.agent;

/**
 * Executes one claimed task on behalf of a worker. Exceptions count as task failures.
 */
public interface TaskExecutor {
    String kind();

    TaskOutcome execute(ExecutionContext context) throws Exception;
}
