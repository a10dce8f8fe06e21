package io.crewmesh.agent;

public record TaskOutcome(
        boolean success,
        String output,
        String error,
        String errorClass
) {
    public static final String DEFAULT_ERROR_CLASS = "task_error";

    public static TaskOutcome ok(String output) {
        return new TaskOutcome(true, output, null, null);
    }

    public static TaskOutcome fail(String error) {
        return new TaskOutcome(false, null, error, DEFAULT_ERROR_CLASS);
    }

    public static TaskOutcome fail(String errorClass, String error) {
        return new TaskOutcome(false, null, error, errorClass);
    }
}
