package io.crewmesh.agent;

public final class FailTaskExecutor implements TaskExecutor {
    @Override
    public String kind() {
        return "fail";
    }

    @Override
    public TaskOutcome execute(ExecutionContext context) {
        return TaskOutcome.fail("intentional_failure", "intentional failure from fail executor");
    }
}
