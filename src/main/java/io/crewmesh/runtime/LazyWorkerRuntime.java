package io.crewmesh.runtime;

import io.crewmesh.config.WorkerDefinition;
import io.crewmesh.model.Review;
import io.crewmesh.model.Task;
import io.crewmesh.model.TaskStatus;
import io.crewmesh.storage.RoleMatcher;
import io.crewmesh.storage.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Starts only the always-on workers eagerly and everything else on demand.
 *
 * <p>An idle monitor owned by this runtime runs on a fixed interval. Each cycle starts a
 * registered worker for pending work no running worker can serve, and stops on-demand workers
 * that have held no task for longer than the idle timeout.
 */
public final class LazyWorkerRuntime implements WorkerRuntime {
    private static final Logger LOG = LoggerFactory.getLogger(LazyWorkerRuntime.class);

    private final WorkerRuntime delegate;
    private final WorkQueue queue;
    private final Set<String> alwaysOn;
    private final long idleShutdownMs;
    private final long monitorIntervalMs;
    private final Clock clock;
    private final Map<String, WorkerDefinition> registered = new LinkedHashMap<>();
    private final Map<String, Long> lastActivity = new HashMap<>();
    private ScheduledExecutorService monitor;
    private boolean stopped;

    public LazyWorkerRuntime(
            WorkerRuntime delegate,
            WorkQueue queue,
            Set<String> alwaysOn,
            Duration idleShutdown,
            Duration monitorInterval,
            Clock clock
    ) {
        if (delegate instanceof LazyWorkerRuntime) {
            throw new IllegalArgumentException("lazy runtime cannot wrap another lazy runtime");
        }
        this.delegate = delegate;
        this.queue = queue;
        this.alwaysOn = Set.copyOf(alwaysOn);
        this.idleShutdownMs = idleShutdown.toMillis();
        this.monitorIntervalMs = Math.max(1L, monitorInterval.toMillis());
        this.clock = clock;
    }

    public WorkerRuntime delegate() {
        return delegate;
    }

    public synchronized void register(WorkerDefinition worker) {
        registered.put(worker.id(), worker);
    }

    @Override
    public synchronized void start(WorkerDefinition worker) {
        register(worker);
        delegate.start(worker);
        touch(worker.id());
    }

    /**
     * Registers every worker, starts the always-on ones and the idle monitor.
     */
    @Override
    public synchronized void startAll(List<WorkerDefinition> workers) {
        stopped = false;
        for (WorkerDefinition worker : workers) {
            register(worker);
            if (alwaysOn.contains(worker.id())) {
                start(worker);
            }
        }
        LOG.info("lazy runtime registered {} worker(s), started {}", registered.size(),
                workers.stream().map(WorkerDefinition::id).filter(alwaysOn::contains).collect(Collectors.toList()));
        startMonitor();
    }

    @Override
    public boolean isAlive(String workerId) {
        return delegate.isAlive(workerId);
    }

    @Override
    public synchronized List<String> workerIds() {
        return List.copyOf(registered.keySet());
    }

    @Override
    public synchronized void stop(String workerId) {
        delegate.stop(workerId);
        lastActivity.remove(workerId);
    }

    @Override
    public synchronized void stopAll() {
        stopped = true;
        stopMonitor();
        delegate.stopAll();
        lastActivity.clear();
    }

    @Override
    public synchronized void ensureRunning(String workerId) {
        if (delegate.isAlive(workerId)) {
            touch(workerId);
            return;
        }
        WorkerDefinition worker = registered.get(workerId);
        if (worker == null) {
            throw new IllegalStateException("unknown worker: " + workerId);
        }
        LOG.info("[{}] starting on demand", workerId);
        delegate.start(worker);
        touch(workerId);
    }

    @Override
    public int pruneDead() {
        return delegate.pruneDead();
    }

    private void touch(String workerId) {
        lastActivity.put(workerId, clock.millis());
    }

    @Override
    public void close() {
        stopAll();
        delegate.close();
    }

    /**
     * One idle-monitor cycle. Errors are logged so a failing cycle does not stop the monitor.
     */
    synchronized void monitorTick() {
        if (stopped) {
            return;
        }
        try {
            startForPendingDemand();
            stopIdleWorkers();
        } catch (RuntimeException e) {
            LOG.warn("idle monitor cycle failed: {}", e.getMessage(), e);
        }
    }

    synchronized boolean monitorRunning() {
        return monitor != null && !monitor.isShutdown();
    }

    private void startForPendingDemand() {
        List<Task> pending = queue.list(TaskStatus.PENDING);
        Set<String> started = new LinkedHashSet<>();
        for (Task task : pending) {
            if (anyRunningServes(task.requiredRole())) {
                continue;
            }
            Optional<WorkerDefinition> candidate = registered.values().stream()
                    .filter(w -> !delegate.isAlive(w.id()))
                    .filter(w -> RoleMatcher.serves(task.requiredRole(), w.id(), w.role()))
                    .findFirst();
            if (candidate.isPresent() && started.add(candidate.get().id())) {
                LOG.info("[{}] pending task {} needs role '{}'", candidate.get().id(), task.id(),
                        task.requiredRole() == null ? "any" : task.requiredRole());
                ensureRunning(candidate.get().id());
            }
        }
    }

    private boolean anyRunningServes(String requiredRole) {
        return registered.values().stream()
                .filter(w -> delegate.isAlive(w.id()))
                .anyMatch(w -> RoleMatcher.serves(requiredRole, w.id(), w.role()));
    }

    private void stopIdleWorkers() {
        long now = clock.millis();
        Map<String, Long> queueActivity = new HashMap<>();
        for (Task task : queue.list()) {
            if (task.agentId() != null) {
                long seen = task.status().active() ? now : lastTouched(task);
                queueActivity.merge(task.agentId(), seen, Math::max);
            }
            for (Review review : task.reviews()) {
                queueActivity.merge(review.reviewer(), review.reviewedAtMs(), Math::max);
            }
        }
        for (String workerId : List.copyOf(registered.keySet())) {
            if (alwaysOn.contains(workerId) || !delegate.isAlive(workerId)) {
                continue;
            }
            Long seen = queueActivity.get(workerId);
            if (seen != null) {
                lastActivity.merge(workerId, seen, Math::max);
            }
            long idleFor = now - lastActivity.getOrDefault(workerId, now);
            if (idleFor > idleShutdownMs) {
                LOG.info("[{}] idle for {}ms, stopping", workerId, idleFor);
                stop(workerId);
            }
        }
    }

    private static long lastTouched(Task task) {
        long latest = task.updatedAtMs();
        if (task.claimedAtMs() != null) {
            latest = Math.max(latest, task.claimedAtMs());
        }
        if (task.completedAtMs() != null) {
            latest = Math.max(latest, task.completedAtMs());
        }
        return latest;
    }

    private void startMonitor() {
        if (monitor != null) {
            return;
        }
        monitor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "crewmesh-idle-monitor");
            thread.setDaemon(true);
            return thread;
        });
        monitor.scheduleWithFixedDelay(this::monitorTick, monitorIntervalMs, monitorIntervalMs, TimeUnit.MILLISECONDS);
    }

    private void stopMonitor() {
        if (monitor == null) {
            return;
        }
        monitor.shutdownNow();
        monitor = null;
    }
}
