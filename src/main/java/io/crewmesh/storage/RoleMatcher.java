package io.crewmesh.storage;

import java.util.Locale;

/**
 * Keyword routing of tasks to workers. A worker serves a required role when the keyword
 * appears in its role description or its id, ignoring case.
 */
public final class RoleMatcher {
    private RoleMatcher() {
    }

    public static boolean serves(String requiredRole, String workerId, String workerRole) {
        if (requiredRole == null || requiredRole.isBlank()) {
            return true;
        }
        String keyword = requiredRole.trim().toLowerCase(Locale.ROOT);
        if (workerId != null && workerId.toLowerCase(Locale.ROOT).contains(keyword)) {
            return true;
        }
        return workerRole != null && workerRole.toLowerCase(Locale.ROOT).contains(keyword);
    }
}
