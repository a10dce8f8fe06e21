package io.crewmesh.runtime;

import io.crewmesh.config.CrewMeshConfig;
import io.crewmesh.config.QueueSettings;
import io.crewmesh.config.WorkerDefinition;
import io.crewmesh.model.Task;
import io.crewmesh.storage.WorkQueue;
import io.crewmesh.testing.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static io.crewmesh.testing.TestRoots.deleteRecursively;

final class LazyWorkerRuntimeTest {
    private static final List<WorkerDefinition> TEAM = List.of(
            WorkerDefinition.of("lead", "team lead"),
            WorkerDefinition.of("coder", "coder"),
            WorkerDefinition.of("qa", "reviewer"));

    @Test
    void onlyAlwaysOnWorkersStartEagerly() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-lazy-start-");
        MutableClock clock = MutableClock.startingAt(1_000_000L);
        try (LazyWorkerRuntime runtime = newRuntime(root, clock)) {
            runtime.startAll(TEAM);

            Assertions.assertTrue(runtime.isAlive("lead"));
            Assertions.assertFalse(runtime.isAlive("coder"));
            Assertions.assertFalse(runtime.isAlive("qa"));
            Assertions.assertEquals(List.of("lead", "coder", "qa"), runtime.workerIds());
            Assertions.assertTrue(runtime.monitorRunning());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void pendingWorkStartsAWorkerForItsRole() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-lazy-demand-");
        MutableClock clock = MutableClock.startingAt(1_000_000L);
        WorkQueue queue = newQueue(root, clock);
        try (LazyWorkerRuntime runtime = newRuntime(root, clock, queue)) {
            runtime.startAll(TEAM);
            queue.create("no role needed");
            runtime.monitorTick();
            Assertions.assertFalse(runtime.isAlive("coder"));

            queue.create("fix the parser", List.of(), "coder");
            runtime.monitorTick();

            Assertions.assertTrue(runtime.isAlive("coder"));
            Assertions.assertFalse(runtime.isAlive("qa"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void idleWorkersStopButBusyAndAlwaysOnOnesStay() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-lazy-idle-");
        MutableClock clock = MutableClock.startingAt(1_000_000L);
        WorkQueue queue = newQueue(root, clock);
        try (LazyWorkerRuntime runtime = newRuntime(root, clock, queue)) {
            runtime.startAll(TEAM);
            runtime.ensureRunning("coder");
            runtime.ensureRunning("qa");
            Task review = queue.create("check the parser", List.of(), "reviewer");
            queue.claimNext("qa", 70.0, "reviewer");

            clock.advance(Duration.ofSeconds(61));
            runtime.monitorTick();

            Assertions.assertTrue(runtime.isAlive("lead"));
            Assertions.assertFalse(runtime.isAlive("coder"));
            Assertions.assertTrue(runtime.isAlive("qa"));

            queue.complete(review.id());
            clock.advance(Duration.ofSeconds(30));
            runtime.monitorTick();
            Assertions.assertTrue(runtime.isAlive("qa"));

            clock.advance(Duration.ofSeconds(31));
            runtime.monitorTick();
            Assertions.assertFalse(runtime.isAlive("qa"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void workerFinishingShortTasksBetweenCyclesStaysAlive() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-lazy-churn-");
        MutableClock clock = MutableClock.startingAt(1_000_000L);
        WorkQueue queue = newQueue(root, clock);
        try (LazyWorkerRuntime runtime = newRuntime(root, clock, queue)) {
            runtime.startAll(TEAM);
            runtime.ensureRunning("coder");

            for (int second = 10; second <= 80; second += 10) {
                clock.advance(Duration.ofSeconds(5));
                Task task = queue.create("short job at " + second + "s", List.of(), "coder");
                Task claimed = queue.claimNext("coder", 70.0, "coder").orElseThrow();
                Assertions.assertEquals(task.id(), claimed.id());
                queue.complete(claimed.id());
                clock.advance(Duration.ofSeconds(5));
                runtime.monitorTick();
                Assertions.assertTrue(runtime.isAlive("coder"), "stopped after " + second + "s");
            }

            clock.advance(Duration.ofSeconds(61));
            runtime.monitorTick();
            Assertions.assertFalse(runtime.isAlive("coder"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stoppedRuntimeIgnoresDemand() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-lazy-stopped-");
        MutableClock clock = MutableClock.startingAt(1_000_000L);
        WorkQueue queue = newQueue(root, clock);
        try (LazyWorkerRuntime runtime = newRuntime(root, clock, queue)) {
            runtime.startAll(TEAM);
            runtime.stopAll();
            queue.create("fix the parser", List.of(), "coder");

            runtime.monitorTick();

            Assertions.assertFalse(runtime.monitorRunning());
            Assertions.assertFalse(runtime.isAlive("lead"));
            Assertions.assertFalse(runtime.isAlive("coder"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void ensureRunningRejectsUnregisteredWorkers() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-lazy-unknown-");
        try (LazyWorkerRuntime runtime = newRuntime(root, MutableClock.startingAt(1_000_000L))) {
            Assertions.assertThrows(IllegalStateException.class, () -> runtime.ensureRunning("ghost"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cannotWrapAnotherLazyRuntime() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-lazy-nested-");
        MutableClock clock = MutableClock.startingAt(1_000_000L);
        try (LazyWorkerRuntime inner = newRuntime(root, clock)) {
            Assertions.assertThrows(IllegalArgumentException.class, () -> new LazyWorkerRuntime(
                    inner, newQueue(root, clock), Set.of(), Duration.ofSeconds(60), Duration.ofHours(1), clock));
        } finally {
            deleteRecursively(root);
        }
    }

    private static WorkQueue newQueue(Path root, MutableClock clock) {
        return new WorkQueue(CrewMeshConfig.fromRoot(root.toString()), QueueSettings.defaults(), clock);
    }

    private static LazyWorkerRuntime newRuntime(Path root, MutableClock clock) {
        return newRuntime(root, clock, newQueue(root, clock));
    }

    private static LazyWorkerRuntime newRuntime(Path root, MutableClock clock, WorkQueue queue) {
        CooperativeWorkerRuntime delegate = new CooperativeWorkerRuntime(w -> () -> TickResult.IDLE, Duration.ofMillis(20));
        return new LazyWorkerRuntime(delegate, queue, Set.of("lead"), Duration.ofSeconds(60), Duration.ofHours(1), clock);
    }
}
