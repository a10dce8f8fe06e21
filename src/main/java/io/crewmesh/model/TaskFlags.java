package io.crewmesh.model;

import java.util.Collection;
import java.util.Locale;

/**
 * Structured evolution flags attached to tasks.
 *
 * <p>Only the prefixed forms are signals. The bare {@code review_failed} tag written by older
 * deployments is kept on disk but never counted as a failure or a rework.
 */
public final class TaskFlags {
    public static final String FAILED_PREFIX = "failed:";
    public static final String TIMEOUT_RECOVERED_PREFIX = "timeout_recovered:";
    public static final String LEGACY_REVIEW_FAILED = "review_failed";
    public static final String REVIEW_REJECTED = FAILED_PREFIX + "review_rejected";

    private TaskFlags() {
    }

    public static String failed(String reason) {
        return FAILED_PREFIX + normalizeReason(reason);
    }

    public static String timeoutRecovered(TaskStatus previous) {
        return TIMEOUT_RECOVERED_PREFIX + previous.wireName();
    }

    public static boolean isFailure(String flag) {
        return flag != null && flag.startsWith(FAILED_PREFIX);
    }

    public static boolean isRework(String flag) {
        return flag != null && (flag.startsWith(FAILED_PREFIX) || flag.startsWith(TIMEOUT_RECOVERED_PREFIX));
    }

    public static boolean anyFailure(Collection<String> flags) {
        return flags != null && flags.stream().anyMatch(TaskFlags::isFailure);
    }

    public static boolean anyRework(Collection<String> flags) {
        return flags != null && flags.stream().anyMatch(TaskFlags::isRework);
    }

    private static String normalizeReason(String reason) {
        if (reason == null || reason.isBlank()) {
            return "unknown";
        }
        String normalized = reason.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_.-]+", "_");
        return normalized.length() > 64 ? normalized.substring(0, 64) : normalized;
    }
}
