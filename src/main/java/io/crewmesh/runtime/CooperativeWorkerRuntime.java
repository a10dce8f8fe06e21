package io.crewmesh.runtime;

import io.crewmesh.config.WorkerDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * All workers share one scheduler thread; each worker is a periodic {@link WorkerTick}.
 *
 * <p>The scheduler thread never runs a tick itself. It hands each tick to a bounded work pool and
 * collects the result on a later cycle, so a worker stuck in a long task execution, a review
 * call or a lock wait does not hold up the others. A worker has at most one tick in flight.
 *
 * <p>Stopping a worker cancels its scheduled future; a tick already in flight runs to completion
 * and its result is dropped. A tick that throws ends only that worker; {@link #ensureRunning}
 * starts it again from its remembered definition.
 */
public final class CooperativeWorkerRuntime implements WorkerRuntime {
    private static final Logger LOG = LoggerFactory.getLogger(CooperativeWorkerRuntime.class);

    static final int DEFAULT_WORK_THREADS = Math.max(4, Runtime.getRuntime().availableProcessors());

    private final WorkerTickFactory ticks;
    private final long tickIntervalMs;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workPool;
    private final Map<String, WorkerDefinition> definitions = new LinkedHashMap<>();
    private final Map<String, CooperativeWorker> workers = new LinkedHashMap<>();

    public CooperativeWorkerRuntime(WorkerTickFactory ticks, Duration tickInterval) {
        this(ticks, tickInterval, DEFAULT_WORK_THREADS);
    }

    public CooperativeWorkerRuntime(WorkerTickFactory ticks, Duration tickInterval, int workThreads) {
        this.ticks = ticks;
        this.tickIntervalMs = Math.max(1L, tickInterval.toMillis());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "crewmesh-cooperative");
            thread.setDaemon(true);
            return thread;
        });
        AtomicInteger workerThreads = new AtomicInteger();
        this.workPool = Executors.newFixedThreadPool(Math.max(1, workThreads), r -> {
            Thread thread = new Thread(r, "crewmesh-cooperative-work-" + workerThreads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public synchronized void start(WorkerDefinition worker) {
        definitions.put(worker.id(), worker);
        if (isAlive(worker.id())) {
            return;
        }
        CooperativeWorker entry = new CooperativeWorker(worker.id(), ticks.create(worker));
        workers.put(worker.id(), entry);
        entry.future = scheduler.scheduleWithFixedDelay(() -> poll(entry), 0L, tickIntervalMs, TimeUnit.MILLISECONDS);
        if (entry.finished) {
            entry.future.cancel(false);
        }
        LOG.info("[{}] started cooperative worker", worker.id());
    }

    @Override
    public synchronized boolean isAlive(String workerId) {
        CooperativeWorker entry = workers.get(workerId);
        return entry != null && !entry.finished && entry.future != null && !entry.future.isDone();
    }

    @Override
    public synchronized List<String> workerIds() {
        return List.copyOf(definitions.keySet());
    }

    @Override
    public synchronized void stop(String workerId) {
        CooperativeWorker entry = workers.remove(workerId);
        if (entry != null) {
            entry.finish();
            LOG.info("[{}] stopped cooperative worker", workerId);
        }
    }

    @Override
    public synchronized void stopAll() {
        for (String workerId : List.copyOf(workers.keySet())) {
            stop(workerId);
        }
    }

    @Override
    public synchronized void ensureRunning(String workerId) {
        if (isAlive(workerId)) {
            return;
        }
        WorkerDefinition definition = definitions.get(workerId);
        if (definition == null) {
            throw new IllegalStateException("unknown worker: " + workerId);
        }
        LOG.info("[{}] restarting cooperative worker", workerId);
        start(definition);
    }

    @Override
    public synchronized int pruneDead() {
        List<String> dead = workers.entrySet().stream()
                .filter(e -> e.getValue().finished)
                .map(Map.Entry::getKey)
                .toList();
        dead.forEach(workers::remove);
        return dead.size();
    }

    @Override
    public void close() {
        stopAll();
        scheduler.shutdown();
        workPool.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            if (!workPool.awaitTermination(5, TimeUnit.SECONDS)) {
                workPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            workPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One scheduler cycle for {@code entry}: collect a finished tick, then submit the next one.
     */
    private void poll(CooperativeWorker entry) {
        if (entry.finished) {
            return;
        }
        Future<TickResult> inFlight = entry.inFlight;
        if (inFlight != null) {
            if (!inFlight.isDone()) {
                return;
            }
            entry.inFlight = null;
            TickResult result;
            try {
                result = inFlight.get();
            } catch (ExecutionException e) {
                LOG.error("[{}] cooperative worker crashed", entry.workerId, e.getCause());
                entry.finish();
                return;
            } catch (CancellationException e) {
                entry.finish();
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (result == TickResult.SHUTDOWN) {
                LOG.info("[{}] cooperative worker exiting on shutdown request", entry.workerId);
                entry.finish();
                return;
            }
        }
        try {
            entry.inFlight = workPool.submit(entry.tick::tick);
        } catch (RejectedExecutionException e) {
            LOG.warn("[{}] work pool closed, stopping cooperative worker", entry.workerId);
            entry.finish();
        }
    }

    private static final class CooperativeWorker {
        private final String workerId;
        private final WorkerTick tick;
        private volatile ScheduledFuture<?> future;
        private volatile Future<TickResult> inFlight;
        private volatile boolean finished;

        private CooperativeWorker(String workerId, WorkerTick tick) {
            this.workerId = workerId;
            this.tick = tick;
        }

        private void finish() {
            finished = true;
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
