package io.crewmesh.agent;

public record ExecutionContext(
        String workerId,
        String role,
        String model,
        String taskId,
        String description,
        String promptOverrides
) {
    /**
     * Role, active overrides and task description as one prompt text.
     */
    public String prompt() {
        StringBuilder sb = new StringBuilder();
        if (role != null && !role.isBlank()) {
            sb.append("Role: ").append(role.strip()).append("\n\n");
        }
        if (promptOverrides != null && !promptOverrides.isBlank()) {
            sb.append(promptOverrides.strip()).append("\n\n");
        }
        sb.append(description == null ? "" : description.strip());
        return sb.toString();
    }
}
