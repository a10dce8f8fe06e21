package io.crewmesh.storage;

import io.crewmesh.config.CrewMeshConfig;
import io.crewmesh.config.QueueSettings;
import io.crewmesh.model.Task;
import io.crewmesh.model.TaskFlags;
import io.crewmesh.model.TaskStatus;
import io.crewmesh.testing.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.crewmesh.testing.TestRoots.deleteRecursively;

final class WorkQueueTest {

    @Test
    void concurrentClaimersGetEachTaskExactlyOnce() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-queue-claim-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            CrewMeshConfig config = CrewMeshConfig.fromRoot(root.toString());
            WorkQueue seed = new WorkQueue(config, QueueSettings.defaults(), MutableClock.startingAt(1_000L));
            for (int i = 0; i < 20; i++) {
                seed.create("task " + i);
            }

            CountDownLatch start = new CountDownLatch(1);
            List<Future<List<String>>> futures = new ArrayList<>();
            for (int w = 0; w < 8; w++) {
                String workerId = "worker-" + w;
                WorkQueue queue = new WorkQueue(config, QueueSettings.defaults(), MutableClock.startingAt(2_000L));
                futures.add(pool.submit(() -> {
                    start.await();
                    List<String> mine = new ArrayList<>();
                    while (true) {
                        Optional<Task> claimed = queue.claimNext(workerId, 70.0, "");
                        if (claimed.isEmpty()) {
                            return mine;
                        }
                        mine.add(claimed.get().id());
                    }
                }));
            }
            start.countDown();

            List<String> all = Collections.synchronizedList(new ArrayList<>());
            for (Future<List<String>> future : futures) {
                all.addAll(future.get(30, TimeUnit.SECONDS));
            }
            Set<String> unique = new HashSet<>(all);
            Assertions.assertEquals(20, all.size());
            Assertions.assertEquals(20, unique.size());
            Assertions.assertEquals(20L, seed.list(TaskStatus.CLAIMED).size());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void claimsInCreationOrder() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-queue-order-");
        try {
            WorkQueue queue = newQueue(root, MutableClock.startingAt(1_000L));
            Task first = queue.create("first");
            Task second = queue.create("second");

            Assertions.assertEquals(first.id(), queue.claimNext("w1", 70.0, "").orElseThrow().id());
            Assertions.assertEquals(second.id(), queue.claimNext("w1", 70.0, "").orElseThrow().id());
            Assertions.assertTrue(queue.claimNext("w1", 70.0, "").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void blockedTaskBecomesClaimableOnlyAfterBlockerCompletes() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-queue-deps-");
        try {
            WorkQueue queue = newQueue(root, MutableClock.startingAt(1_000L));
            Task a = queue.create("A");
            Task b = queue.create("B", List.of(a.id()), null);
            Assertions.assertEquals(TaskStatus.BLOCKED, b.status());

            Task claimedA = queue.claimNext("w1", 70.0, "").orElseThrow();
            Assertions.assertEquals(a.id(), claimedA.id());
            Assertions.assertTrue(queue.claimNext("w2", 70.0, "").isEmpty());

            queue.complete(a.id());
            Assertions.assertEquals(TaskStatus.PENDING, queue.get(b.id()).orElseThrow().status());
            Task claimedB = queue.claimNext("w2", 70.0, "").orElseThrow();
            Assertions.assertEquals(b.id(), claimedB.id());
            Assertions.assertEquals("w2", claimedB.agentId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void taskCreatedAfterItsBlockerCompletedStartsPending() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-queue-deps-done-");
        try {
            WorkQueue queue = newQueue(root, MutableClock.startingAt(1_000L));
            Task a = queue.create("A");
            queue.claimNext("w1", 70.0, "");
            queue.complete(a.id());

            Task b = queue.create("B", List.of(a.id()), null);
            Assertions.assertEquals(TaskStatus.PENDING, b.status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void roleRequirementRoutesToMatchingWorker() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-queue-role-");
        try {
            WorkQueue queue = newQueue(root, MutableClock.startingAt(1_000L));
            Task review = queue.create("audit the diff", List.of(), "Reviewer");

            Assertions.assertTrue(queue.claimNext("builder-1", 70.0, "writes code").isEmpty());
            Assertions.assertEquals(review.id(), queue.claimNext("qa-1", 70.0, "senior reviewer").orElseThrow().id());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reviewRejectionRequeuesWithReworkFlag() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-queue-review-");
        try {
            WorkQueue queue = newQueue(root, MutableClock.startingAt(1_000L));
            Task task = queue.create("write docs");
            queue.claimNext("w1", 70.0, "");
            Assertions.assertTrue(queue.submitForReview(task.id(), "draft"));
            Assertions.assertTrue(queue.addReview(task.id(), "w2", 140.0, "too short"));

            Task reviewed = queue.get(task.id()).orElseThrow();
            Assertions.assertEquals(TaskStatus.REVIEW, reviewed.status());
            Assertions.assertEquals("draft", reviewed.result());
            Assertions.assertEquals(100.0, reviewed.reviews().get(0).score());

            Task reworked = queue.complete(task.id(), CompletionDecision.REWORK).orElseThrow();
            Assertions.assertEquals(TaskStatus.PENDING, reworked.status());
            Assertions.assertNull(reworked.agentId());
            Assertions.assertTrue(reworked.evolutionFlags().contains(TaskFlags.REVIEW_REJECTED));
            Assertions.assertTrue(TaskFlags.anyRework(reworked.evolutionFlags()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failRecordsNormalizedReasonFlag() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-queue-fail-");
        try {
            WorkQueue queue = newQueue(root, MutableClock.startingAt(1_000L));
            Task task = queue.create("flaky");
            queue.claimNext("w1", 70.0, "");

            Task failed = queue.fail(task.id(), "Tool Crashed!").orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, failed.status());
            Assertions.assertEquals(List.of("failed:tool_crashed_"), failed.evolutionFlags());
            Assertions.assertNotNull(failed.completedAtMs());

            Assertions.assertEquals(failed, queue.fail(task.id(), "again").orElseThrow());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void recoversOnlyTasksPastTheLease() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-queue-stale-");
        try {
            MutableClock clock = MutableClock.startingAt(1_000L);
            WorkQueue queue = new WorkQueue(CrewMeshConfig.fromRoot(root.toString()),
                    new QueueSettings(60_000L, 0L, 0L), clock);
            Task stale = queue.create("stale");
            Task fresh = queue.create("fresh");
            queue.claimNext("w1", 70.0, "");
            queue.submitForReview(stale.id(), "out");

            clock.advance(Duration.ofSeconds(45));
            queue.claimNext("w2", 70.0, "");
            clock.advance(Duration.ofSeconds(20));

            List<Task> recovered = queue.recoverStaleTasks();
            Assertions.assertEquals(1, recovered.size());
            Task reset = queue.get(stale.id()).orElseThrow();
            Assertions.assertEquals(TaskStatus.PENDING, reset.status());
            Assertions.assertNull(reset.agentId());
            Assertions.assertNull(reset.claimedAtMs());
            Assertions.assertEquals(List.of("timeout_recovered:review"), reset.evolutionFlags());
            Assertions.assertEquals(TaskStatus.CLAIMED, queue.get(fresh.id()).orElseThrow().status());

            Assertions.assertTrue(queue.recoverStaleTasks().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void operatorTransitions() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-queue-ops-");
        try {
            WorkQueue queue = newQueue(root, MutableClock.startingAt(1_000L));
            Task task = queue.create("pausable");

            Assertions.assertTrue(queue.pause(task.id()));
            Assertions.assertTrue(queue.claimNext("w1", 70.0, "").isEmpty());
            Assertions.assertFalse(queue.pause(task.id()));
            Assertions.assertTrue(queue.resume(task.id()));
            Assertions.assertEquals(TaskStatus.PENDING, queue.get(task.id()).orElseThrow().status());

            Assertions.assertTrue(queue.cancel(task.id()));
            Assertions.assertFalse(queue.cancel(task.id()));
            Assertions.assertFalse(queue.resume(task.id()));

            Assertions.assertTrue(queue.retry(task.id()));
            Task retried = queue.get(task.id()).orElseThrow();
            Assertions.assertEquals(TaskStatus.PENDING, retried.status());
            Assertions.assertEquals(1, retried.retryCount());
            Assertions.assertFalse(queue.retry(task.id()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownTaskIdsAreNoOps() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-queue-missing-");
        try {
            WorkQueue queue = newQueue(root, MutableClock.startingAt(1_000L));
            queue.create("only");

            Assertions.assertTrue(queue.complete("tsk_missing").isEmpty());
            Assertions.assertTrue(queue.fail("tsk_missing", "x").isEmpty());
            Assertions.assertFalse(queue.submitForReview("tsk_missing", "x"));
            Assertions.assertFalse(queue.addReview("tsk_missing", "w", 50.0, ""));
            Assertions.assertFalse(queue.flag("tsk_missing", "failed:x"));
            Assertions.assertFalse(queue.cancel("tsk_missing"));
            Assertions.assertFalse(queue.pause("tsk_missing"));
            Assertions.assertFalse(queue.resume("tsk_missing"));
            Assertions.assertFalse(queue.retry("tsk_missing"));
            Assertions.assertEquals(1, queue.list().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void completeIgnoresTasksThatAreNotActive() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-queue-complete-");
        try {
            WorkQueue queue = newQueue(root, MutableClock.startingAt(1_000L));
            Task task = queue.create("not claimed yet");

            Task unchanged = queue.complete(task.id()).orElseThrow();
            Assertions.assertEquals(TaskStatus.PENDING, unchanged.status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void historyIsMostRecentFirstAndBounded() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-queue-history-");
        try {
            WorkQueue queue = newQueue(root, MutableClock.startingAt(1_000L));
            List<String> ids = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                ids.add(queue.create("t" + i).id());
                queue.claimNext("w1", 70.0, "");
                queue.complete(ids.get(i));
            }
            queue.create("someone else's");
            queue.claimNext("w2", 70.0, "");

            List<Task> history = queue.history("w1", 2);
            Assertions.assertEquals(List.of(ids.get(2), ids.get(1)), history.stream().map(Task::id).toList());
            Assertions.assertEquals(1, queue.history("w2", 10).size());
            Assertions.assertTrue(queue.history("nobody", 10).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void clearRefusesWhileTasksAreActiveUnlessForced() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-queue-clear-");
        try {
            WorkQueue queue = newQueue(root, MutableClock.startingAt(1_000L));
            queue.create("a");
            queue.create("b");
            queue.claimNext("w1", 70.0, "");

            WorkQueue.ClearResult refused = queue.clear(false);
            Assertions.assertFalse(refused.cleared());
            Assertions.assertEquals(1, refused.activeTasks());
            Assertions.assertEquals(2, queue.list().size());

            WorkQueue.ClearResult forced = queue.clear(true);
            Assertions.assertTrue(forced.cleared());
            Assertions.assertEquals(2, forced.removed());
            Assertions.assertTrue(queue.list().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stateSurvivesANewQueueInstance() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-queue-persist-");
        try {
            WorkQueue first = newQueue(root, MutableClock.startingAt(1_000L));
            Task task = first.create("persist me");
            first.claimNext("w1", 70.0, "");

            WorkQueue second = newQueue(root, MutableClock.startingAt(5_000L));
            Task loaded = second.get(task.id()).orElseThrow();
            Assertions.assertEquals(TaskStatus.CLAIMED, loaded.status());
            Assertions.assertEquals("w1", loaded.agentId());
            Assertions.assertEquals(1L, second.countsByStatus().get(TaskStatus.CLAIMED));
            Assertions.assertEquals(0L, second.pendingCount());
        } finally {
            deleteRecursively(root);
        }
    }

    private static WorkQueue newQueue(Path root, MutableClock clock) {
        return new WorkQueue(CrewMeshConfig.fromRoot(root.toString()), QueueSettings.defaults(), clock);
    }
}
