package io.crewmesh.runtime;

import io.crewmesh.bus.Mailbox;
import io.crewmesh.config.WorkerDefinition;
import io.crewmesh.model.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * One OS process per worker. Stopping asks the worker to exit through its mailbox, waits for the
 * grace period, then terminates the process and finally kills it.
 */
public final class ProcessWorkerRuntime implements WorkerRuntime {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessWorkerRuntime.class);
    private static final long TERMINATE_WAIT_MS = 3_000L;
    private static final long POLL_MS = 50L;

    private final ProcessLauncher launcher;
    private final Mailbox mailbox;
    private final Duration gracePeriod;
    private final Map<String, Process> processes = new LinkedHashMap<>();

    public ProcessWorkerRuntime(ProcessLauncher launcher, Mailbox mailbox, Duration gracePeriod) {
        this.launcher = launcher;
        this.mailbox = mailbox;
        this.gracePeriod = gracePeriod;
    }

    @Override
    public synchronized void start(WorkerDefinition worker) {
        Process existing = processes.get(worker.id());
        if (existing != null && existing.isAlive()) {
            return;
        }
        try {
            Process process = launcher.launch(worker);
            processes.put(worker.id(), process);
            LOG.info("[{}] started worker process pid={}", worker.id(), process.pid());
        } catch (IOException e) {
            throw new RuntimeException("Failed to launch worker process: " + worker.id(), e);
        }
    }

    @Override
    public synchronized boolean isAlive(String workerId) {
        Process process = processes.get(workerId);
        return process != null && process.isAlive();
    }

    @Override
    public synchronized List<String> workerIds() {
        return List.copyOf(processes.keySet());
    }

    @Override
    public synchronized void stop(String workerId) {
        Process process = processes.remove(workerId);
        if (process == null) {
            return;
        }
        if (process.isAlive()) {
            requestShutdown(workerId);
            awaitExit(List.of(process), System.nanoTime() + gracePeriod.toNanos());
            terminate(workerId, process);
        }
    }

    /**
     * Sends every shutdown request first so all workers share one grace period.
     */
    @Override
    public synchronized void stopAll() {
        Map<String, Process> alive = new LinkedHashMap<>();
        processes.forEach((id, process) -> {
            if (process.isAlive()) {
                alive.put(id, process);
            }
        });
        processes.clear();
        alive.keySet().forEach(this::requestShutdown);
        awaitExit(new ArrayList<>(alive.values()), System.nanoTime() + gracePeriod.toNanos());
        alive.forEach(this::terminate);
    }

    @Override
    public synchronized int pruneDead() {
        List<String> dead = processes.entrySet().stream()
                .filter(e -> !e.getValue().isAlive())
                .map(Map.Entry::getKey)
                .toList();
        dead.forEach(processes::remove);
        return dead.size();
    }

    private void requestShutdown(String workerId) {
        try {
            mailbox.send(workerId, "runtime", MessageType.SHUTDOWN, "stop requested");
        } catch (RuntimeException e) {
            LOG.warn("[{}] could not deliver shutdown message, signalling instead: {}", workerId, e.getMessage());
        }
    }

    private static void awaitExit(List<Process> pending, long deadlineNanos) {
        try {
            while (System.nanoTime() < deadlineNanos && pending.stream().anyMatch(Process::isAlive)) {
                Thread.sleep(POLL_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void terminate(String workerId, Process process) {
        if (!process.isAlive()) {
            LOG.info("[{}] worker process exited", workerId);
            return;
        }
        process.destroy();
        try {
            if (!process.waitFor(TERMINATE_WAIT_MS, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                LOG.warn("[{}] worker process killed", workerId);
                return;
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
        LOG.info("[{}] worker process terminated", workerId);
    }
}
