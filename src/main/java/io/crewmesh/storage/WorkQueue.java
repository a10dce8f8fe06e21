package io.crewmesh.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.crewmesh.config.CrewMeshConfig;
import io.crewmesh.config.QueueSettings;
import io.crewmesh.model.Review;
import io.crewmesh.model.Task;
import io.crewmesh.model.TaskFlags;
import io.crewmesh.model.TaskStatus;
import io.crewmesh.storage.LockedJsonDocument.Change;
import io.crewmesh.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * File-backed task queue shared by every worker on the host.
 *
 * <p>The whole queue is one JSON object keyed by task id. Every mutation, including
 * {@link #claimNext}, reads, modifies and rewrites the full document under a single advisory
 * lock, which is what makes a claim exactly-once across threads and processes. Operations on
 * unknown task ids are no-ops.
 */
public final class WorkQueue {
    private static final Logger LOG = LoggerFactory.getLogger(WorkQueue.class);
    private static final Comparator<Task> CREATION_ORDER =
            Comparator.comparingLong(Task::sequence).thenComparingLong(Task::createdAtMs);

    private final LockedJsonDocument<LinkedHashMap<String, Task>> document;
    private final long leaseTimeoutMs;
    private final Clock clock;

    public WorkQueue(CrewMeshConfig config, QueueSettings settings, Clock clock) {
        this.document = new LockedJsonDocument<>(
                config.queueFile(),
                config.queueLock(),
                new TypeReference<LinkedHashMap<String, Task>>() {
                },
                LinkedHashMap::new,
                settings.lockTimeout()
        );
        this.leaseTimeoutMs = settings.leaseTimeoutMs();
        this.clock = clock;
    }

    public Task create(String description) {
        return create(description, List.of(), null);
    }

    public Task create(String description, Collection<String> blockedBy, String requiredRole) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("task description cannot be empty");
        }
        return document.update(tasks -> {
            long now = clock.millis();
            long sequence = tasks.values().stream().mapToLong(Task::sequence).max().orElse(0L) + 1L;
            Task task = Task.create(Ids.newTaskId(), description.trim(), requiredRole, blockedBy, sequence, now);
            if (!dependenciesMet(task, completedIds(tasks))) {
                task = task.withStatus(TaskStatus.BLOCKED, now);
            }
            tasks.put(task.id(), task);
            return Change.write(task);
        });
    }

    /**
     * Claims the oldest eligible task for {@code agentId}. Blocked tasks whose blockers have all
     * completed are promoted to pending first.
     *
     * @param reputation current composite of the claimant, recorded for diagnostics only
     */
    public Optional<Task> claimNext(String agentId, double reputation, String agentRole) {
        return document.update(tasks -> {
            long now = clock.millis();
            Set<String> completed = completedIds(tasks);
            boolean dirty = promoteUnblocked(tasks, completed, now) > 0;
            Optional<Task> candidate = tasks.values().stream()
                    .filter(t -> t.status() == TaskStatus.PENDING)
                    .filter(t -> dependenciesMet(t, completed))
                    .filter(t -> RoleMatcher.serves(t.requiredRole(), agentId, agentRole))
                    .min(CREATION_ORDER);
            if (candidate.isEmpty()) {
                return new Change<>(Optional.empty(), dirty);
            }
            Task claimed = candidate.get().claimedBy(agentId, now);
            tasks.put(claimed.id(), claimed);
            LOG.debug("[{}] claimed {} (reputation {})", agentId, claimed.id(), reputation);
            return Change.write(Optional.of(claimed));
        });
    }

    public boolean submitForReview(String taskId, String result) {
        return mutate(taskId, task -> task.status() == TaskStatus.CLAIMED
                ? task.withResult(result, TaskStatus.REVIEW, clock.millis())
                : null);
    }

    public boolean addReview(String taskId, String reviewerId, double score, String comment) {
        double bounded = Math.max(0.0, Math.min(100.0, score));
        return mutate(taskId, task -> task.withReview(
                new Review(reviewerId, bounded, comment == null ? "" : comment, clock.millis()),
                clock.millis()));
    }

    public Optional<Task> complete(String taskId) {
        return complete(taskId, CompletionDecision.ACCEPT);
    }

    /**
     * Finishes a claimed or reviewed task. {@link CompletionDecision#REWORK} sends it back to the
     * queue with a {@code failed:review_rejected} flag instead. Tasks in any other status are
     * returned unchanged.
     */
    public Optional<Task> complete(String taskId, CompletionDecision decision) {
        return document.update(tasks -> {
            Task task = tasks.get(taskId);
            if (task == null) {
                return Change.keep(Optional.empty());
            }
            if (!task.status().active()) {
                return Change.keep(Optional.of(task));
            }
            long now = clock.millis();
            Task next = decision == CompletionDecision.REWORK
                    ? task.released(TaskFlags.REVIEW_REJECTED, now)
                    : task.completedAt(now);
            tasks.put(taskId, next);
            if (next.status() == TaskStatus.COMPLETED) {
                int promoted = promoteUnblocked(tasks, completedIds(tasks), now);
                if (promoted > 0) {
                    LOG.debug("completion of {} unblocked {} task(s)", taskId, promoted);
                }
            }
            return Change.write(Optional.of(next));
        });
    }

    public Optional<Task> fail(String taskId, String reason) {
        return document.update(tasks -> {
            Task task = tasks.get(taskId);
            if (task == null) {
                return Change.keep(Optional.empty());
            }
            if (task.status().terminal()) {
                return Change.keep(Optional.of(task));
            }
            Task failed = task.failedWith(TaskFlags.failed(reason), clock.millis());
            tasks.put(taskId, failed);
            return Change.write(Optional.of(failed));
        });
    }

    public boolean flag(String taskId, String tag) {
        if (tag == null || tag.isBlank()) {
            return false;
        }
        return mutate(taskId, task -> task.withFlag(tag.trim(), clock.millis()));
    }

    /**
     * Returns tasks whose lease expired (claimed or in review for longer than the lease timeout)
     * to the queue with no owner and a {@code timeout_recovered:<status>} flag.
     */
    public List<Task> recoverStaleTasks() {
        return document.update(tasks -> {
            long now = clock.millis();
            long cutoff = now - leaseTimeoutMs;
            List<Task> recovered = new ArrayList<>();
            for (Task task : List.copyOf(tasks.values())) {
                if (!task.status().active() || task.claimedAtMs() == null || task.claimedAtMs() >= cutoff) {
                    continue;
                }
                Task reset = task.released(TaskFlags.timeoutRecovered(task.status()), now);
                tasks.put(task.id(), reset);
                recovered.add(reset);
                LOG.info("recovered stale task {} from {} (was {})", task.id(), task.agentId(), task.status().wireName());
            }
            return new Change<>(recovered, !recovered.isEmpty());
        });
    }

    public boolean cancel(String taskId) {
        return mutate(taskId, task -> task.status().terminal()
                ? null
                : task.withStatus(TaskStatus.CANCELLED, clock.millis()));
    }

    public int cancelAll() {
        return document.update(tasks -> {
            long now = clock.millis();
            int cancelled = 0;
            for (Task task : List.copyOf(tasks.values())) {
                if (!task.status().terminal()) {
                    tasks.put(task.id(), task.withStatus(TaskStatus.CANCELLED, now));
                    cancelled++;
                }
            }
            return new Change<>(cancelled, cancelled > 0);
        });
    }

    public boolean pause(String taskId) {
        return mutate(taskId, task -> task.status() == TaskStatus.PENDING || task.status() == TaskStatus.BLOCKED
                ? task.withStatus(TaskStatus.PAUSED, clock.millis())
                : null);
    }

    public boolean resume(String taskId) {
        return document.update(tasks -> {
            Task task = tasks.get(taskId);
            if (task == null || task.status() != TaskStatus.PAUSED) {
                return Change.keep(false);
            }
            tasks.put(taskId, task.withStatus(readyStatus(task, completedIds(tasks)), clock.millis()));
            return Change.write(true);
        });
    }

    public boolean retry(String taskId) {
        return document.update(tasks -> {
            Task task = tasks.get(taskId);
            if (task == null || (task.status() != TaskStatus.FAILED && task.status() != TaskStatus.CANCELLED)) {
                return Change.keep(false);
            }
            tasks.put(taskId, task.retried(readyStatus(task, completedIds(tasks)), clock.millis()));
            return Change.write(true);
        });
    }

    /**
     * Removes every task. Refuses while any task is claimed or in review unless forced.
     */
    public ClearResult clear(boolean force) {
        return document.update(tasks -> {
            long active = tasks.values().stream().filter(t -> t.status().active()).count();
            if (active > 0 && !force) {
                return Change.keep(new ClearResult(false, 0, (int) active));
            }
            int removed = tasks.size();
            tasks.clear();
            return new Change<>(new ClearResult(true, removed, (int) active), removed > 0);
        });
    }

    public Optional<Task> get(String taskId) {
        return Optional.ofNullable(document.read().get(taskId));
    }

    public List<Task> list() {
        return document.read().values().stream().sorted(CREATION_ORDER).toList();
    }

    public List<Task> list(TaskStatus status) {
        return list().stream().filter(t -> t.status() == status).toList();
    }

    /**
     * Most recent first.
     */
    public List<Task> history(String agentId, int last) {
        return document.read().values().stream()
                .filter(t -> agentId != null && agentId.equals(t.agentId()))
                .sorted(CREATION_ORDER.reversed())
                .limit(Math.max(0, last))
                .toList();
    }

    public long pendingCount() {
        return document.read().values().stream().filter(t -> t.status() == TaskStatus.PENDING).count();
    }

    public Map<TaskStatus, Long> countsByStatus() {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0L);
        }
        document.read().values().forEach(t -> counts.merge(t.status(), 1L, Long::sum));
        return counts;
    }

    private boolean mutate(String taskId, UnaryOperator<Task> change) {
        return document.update(tasks -> {
            Task task = tasks.get(taskId);
            if (task == null) {
                return Change.keep(false);
            }
            Task next = change.apply(task);
            if (next == null) {
                return Change.keep(false);
            }
            tasks.put(taskId, next);
            return Change.write(true);
        });
    }

    private static int promoteUnblocked(Map<String, Task> tasks, Set<String> completed, long now) {
        int promoted = 0;
        for (Task task : List.copyOf(tasks.values())) {
            if (task.status() == TaskStatus.BLOCKED && dependenciesMet(task, completed)) {
                tasks.put(task.id(), task.withStatus(TaskStatus.PENDING, now));
                promoted++;
            }
        }
        return promoted;
    }

    private static TaskStatus readyStatus(Task task, Set<String> completed) {
        return dependenciesMet(task, completed) ? TaskStatus.PENDING : TaskStatus.BLOCKED;
    }

    private static boolean dependenciesMet(Task task, Set<String> completed) {
        return completed.containsAll(task.blockedBy());
    }

    private static Set<String> completedIds(Map<String, Task> tasks) {
        return tasks.values().stream()
                .filter(t -> t.status() == TaskStatus.COMPLETED)
                .map(Task::id)
                .collect(Collectors.toSet());
    }

    public record ClearResult(boolean cleared, int removed, int activeTasks) {
    }
}
