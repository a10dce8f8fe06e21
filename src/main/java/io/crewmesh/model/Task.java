package io.crewmesh.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

public record Task(
        @JsonProperty("task_id") String id,
        @JsonProperty("description") String description,
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("required_role") String requiredRole,
        @JsonProperty("blocked_by") List<String> blockedBy,
        @JsonProperty("sequence") long sequence,
        @JsonProperty("created_at_ms") long createdAtMs,
        @JsonProperty("claimed_at_ms") Long claimedAtMs,
        @JsonProperty("completed_at_ms") Long completedAtMs,
        @JsonProperty("updated_at_ms") long updatedAtMs,
        @JsonProperty("result") String result,
        @JsonProperty("evolution_flags") List<String> evolutionFlags,
        @JsonProperty("reviews") List<Review> reviews,
        @JsonProperty("retry_count") int retryCount
) {
    public Task {
        blockedBy = blockedBy == null ? List.of() : List.copyOf(blockedBy);
        evolutionFlags = evolutionFlags == null ? List.of() : List.copyOf(evolutionFlags);
        reviews = reviews == null ? List.of() : List.copyOf(reviews);
    }

    public static Task create(
            String id,
            String description,
            String requiredRole,
            Collection<String> blockedBy,
            long sequence,
            long nowMs
    ) {
        List<String> deps = blockedBy == null ? List.of() : blockedBy.stream().distinct().toList();
        return new Task(id, description, TaskStatus.PENDING, null, blankToNull(requiredRole), deps,
                sequence, nowMs, null, null, nowMs, null, List.of(), List.of(), 0);
    }

    public Task withStatus(TaskStatus next, long nowMs) {
        return new Task(id, description, next, agentId, requiredRole, blockedBy, sequence, createdAtMs,
                claimedAtMs, completedAtMs, nowMs, result, evolutionFlags, reviews, retryCount);
    }

    public Task claimedBy(String worker, long nowMs) {
        return new Task(id, description, TaskStatus.CLAIMED, worker, requiredRole, blockedBy, sequence, createdAtMs,
                nowMs, null, nowMs, result, evolutionFlags, reviews, retryCount);
    }

    /**
     * Back to the queue with no owner, as after a lease expiry or a rejected review.
     */
    public Task released(String flag, long nowMs) {
        return new Task(id, description, TaskStatus.PENDING, null, requiredRole, blockedBy, sequence, createdAtMs,
                null, null, nowMs, result, appendFlag(flag), reviews, retryCount);
    }

    public Task withResult(String output, TaskStatus next, long nowMs) {
        return new Task(id, description, next, agentId, requiredRole, blockedBy, sequence, createdAtMs,
                claimedAtMs, completedAtMs, nowMs, output, evolutionFlags, reviews, retryCount);
    }

    public Task completedAt(long nowMs) {
        return new Task(id, description, TaskStatus.COMPLETED, agentId, requiredRole, blockedBy, sequence, createdAtMs,
                claimedAtMs, nowMs, nowMs, result, evolutionFlags, reviews, retryCount);
    }

    public Task failedWith(String flag, long nowMs) {
        return new Task(id, description, TaskStatus.FAILED, agentId, requiredRole, blockedBy, sequence, createdAtMs,
                claimedAtMs, nowMs, nowMs, result, appendFlag(flag), reviews, retryCount);
    }

    public Task withFlag(String flag, long nowMs) {
        return new Task(id, description, status, agentId, requiredRole, blockedBy, sequence, createdAtMs,
                claimedAtMs, completedAtMs, nowMs, result, appendFlag(flag), reviews, retryCount);
    }

    public Task withReview(Review review, long nowMs) {
        List<Review> next = new ArrayList<>(reviews);
        next.add(review);
        return new Task(id, description, status, agentId, requiredRole, blockedBy, sequence, createdAtMs,
                claimedAtMs, completedAtMs, nowMs, result, evolutionFlags, next, retryCount);
    }

    public Task retried(TaskStatus next, long nowMs) {
        return new Task(id, description, next, null, requiredRole, blockedBy, sequence, createdAtMs,
                null, null, nowMs, null, evolutionFlags, reviews, retryCount + 1);
    }

    public boolean hasFlagMatching(Predicate<String> predicate) {
        return evolutionFlags.stream().anyMatch(predicate);
    }

    private List<String> appendFlag(String flag) {
        List<String> next = new ArrayList<>(evolutionFlags);
        next.add(flag);
        return next;
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }
}
