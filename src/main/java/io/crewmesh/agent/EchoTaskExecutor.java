package io.crewmesh.agent;

/**
 * Returns the prompt it was given. Useful for wiring checks and demos.
 */
public final class EchoTaskExecutor implements TaskExecutor {
    @Override
    public String kind() {
        return "echo";
    }

    @Override
    public TaskOutcome execute(ExecutionContext context) {
        return TaskOutcome.ok("# " + context.workerId() + " result for " + context.taskId() + "\n\n" + context.prompt());
    }
}
