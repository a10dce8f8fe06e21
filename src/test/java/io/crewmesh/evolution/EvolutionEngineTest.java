package io.crewmesh.evolution;

import com.fasterxml.jackson.databind.JsonNode;
import io.crewmesh.config.CrewMeshConfig;
import io.crewmesh.config.QueueSettings;
import io.crewmesh.config.TeamSettings;
import io.crewmesh.config.TeamSettingsStore;
import io.crewmesh.config.WorkerDefinition;
import io.crewmesh.llm.ChatClient;
import io.crewmesh.llm.ChatException;
import io.crewmesh.model.Task;
import io.crewmesh.model.TaskFlags;
import io.crewmesh.observability.AuditLogger;
import io.crewmesh.reputation.Dimension;
import io.crewmesh.reputation.ScoreAggregator;
import io.crewmesh.reputation.ThresholdStatus;
import io.crewmesh.storage.WorkQueue;
import io.crewmesh.testing.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.crewmesh.testing.TestRoots.deleteRecursively;

final class EvolutionEngineTest {
    private static final Duration LOCK_TIMEOUT = Duration.ofSeconds(10);

    @Test
    void warningOnlyMonitors() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-evo-warning-");
        try {
            Fixture fx = new Fixture(root, null);
            Assertions.assertTrue(fx.engine.maybeTrigger("worker-a", ThresholdStatus.WARNING).isEmpty());
            Assertions.assertTrue(fx.engine.maybeTrigger("worker-a", ThresholdStatus.WATCH).isEmpty());
            Assertions.assertTrue(fx.engine.pendingEvolutions().isEmpty());
            Assertions.assertEquals("", fx.engine.overrides("worker-a"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void highFailureRateGetsPromptPatch() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-evo-failure-");
        try {
            Fixture fx = new Fixture(root, null);
            fx.saveWorkers(WorkerDefinition.of("flaky", "coder"));
            for (int i = 0; i < 4; i++) {
                Task task = fx.queue.create("job " + i);
                fx.queue.claimNext("flaky", 70.0, "coder");
                if (i % 2 == 0) {
                    fx.queue.fail(task.id(), "crash");
                } else {
                    fx.queue.complete(task.id());
                }
            }

            EvolutionPlan plan = fx.engine.maybeTrigger("flaky", ThresholdStatus.EVOLVE).orElseThrow();
            Assertions.assertEquals(RemediationPath.PROMPT, plan.path());
            Assertions.assertTrue(plan.errorPatterns().contains(EvolutionEngine.HIGH_FAILURE_RATE));
            Assertions.assertTrue(plan.errorPatterns().contains(EvolutionEngine.FREQUENT_REWORK));
            Assertions.assertTrue(plan.rootCause().startsWith("High failure rate"));
            Assertions.assertEquals(0.75, plan.confidence());

            String overrides = fx.engine.overrides("flaky");
            Assertions.assertTrue(overrides.startsWith("## Evolution Override ("));
            Assertions.assertTrue(overrides.contains("state your approach"));
            Assertions.assertTrue(fx.engine.pending("flaky").isEmpty());

            List<JsonNode> log = fx.evolutionLog().tail(10);
            Assertions.assertEquals("evolution.plan", log.get(log.size() - 1).path("action").asText());
            Assertions.assertEquals("prompt", log.get(log.size() - 1).path("result").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void legacyReviewFailedTagIsNotAFailureSignal() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-evo-legacy-");
        try {
            Fixture fx = new Fixture(root, null);
            for (int i = 0; i < 4; i++) {
                Task task = fx.queue.create("job " + i);
                fx.queue.claimNext("veteran", 70.0, "");
                fx.queue.complete(task.id());
                fx.queue.flag(task.id(), TaskFlags.LEGACY_REVIEW_FAILED);
            }

            EvolutionPlan plan = fx.engine.diagnose("veteran");
            Assertions.assertTrue(plan.errorPatterns().isEmpty(), plan.errorPatterns().toString());
            Assertions.assertEquals(RemediationPath.PROMPT, plan.path());
            Assertions.assertTrue(plan.rootCause().startsWith("General underperformance"));
            Assertions.assertEquals(0.5, plan.confidence());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void inconsistentOutputGetsFormatInstructions() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-evo-inconsistent-");
        try {
            Fixture fx = new Fixture(root, null);
            fx.lower("drifter", Dimension.CONSISTENCY);

            EvolutionPlan plan = fx.engine.diagnose("drifter");
            Assertions.assertEquals(List.of(EvolutionEngine.INCONSISTENT_OUTPUT), plan.errorPatterns());
            Assertions.assertEquals(RemediationPath.PROMPT, plan.path());
            Assertions.assertTrue(plan.promptAddition().contains("CONFIDENCE: [0-100]"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stagnationWithFallbackModelProposesModelSwap() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-evo-model-");
        try {
            Fixture fx = new Fixture(root, null);
            fx.saveWorkers(stagnant("big-model", List.of("big-model", "small-model")), WorkerDefinition.of("peer", ""));
            fx.lower("stuck", Dimension.IMPROVEMENT_RATE);
            fx.lower("stuck", Dimension.OUTPUT_QUALITY);

            EvolutionPlan plan = fx.engine.maybeTrigger("stuck", ThresholdStatus.EVOLVE).orElseThrow();
            Assertions.assertEquals(RemediationPath.MODEL, plan.path());
            Assertions.assertEquals("small-model", plan.modelSwap().newModel());
            Assertions.assertEquals("big-model", plan.modelSwap().previousModel());

            PendingEvolution pending = fx.engine.pending("stuck").orElseThrow();
            Assertions.assertEquals(EvolutionState.AWAITING_CONFIRMATION, pending.state());
            Assertions.assertEquals(RemediationPath.MODEL, pending.path());
            Assertions.assertEquals(1, fx.engine.pendingSwaps().size());
            Assertions.assertTrue(fx.engine.maybeTrigger("stuck", ThresholdStatus.EVOLVE).isEmpty());

            ModelSwap applied = fx.engine.applyModelSwap("stuck").orElseThrow();
            Assertions.assertEquals("small-model", applied.newModel());
            Assertions.assertEquals("small-model", fx.settingsStore.load().worker("stuck").orElseThrow().model());
            Assertions.assertEquals(List.of("big-model", "small-model"),
                    fx.settingsStore.load().worker("stuck").orElseThrow().fallbackModels());
            Assertions.assertTrue(fx.engine.pending("stuck").isEmpty());
            Assertions.assertTrue(fx.engine.pendingSwaps().isEmpty());
            Assertions.assertTrue(fx.engine.applyModelSwap("stuck").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void discardedSwapLeavesSettingsAlone() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-evo-discard-");
        try {
            Fixture fx = new Fixture(root, null);
            fx.saveWorkers(stagnant("big-model", List.of()));
            fx.lower("stuck", Dimension.IMPROVEMENT_RATE);
            fx.lower("stuck", Dimension.CONSISTENCY);

            EvolutionPlan plan = fx.engine.maybeTrigger("stuck", ThresholdStatus.EVOLVE).orElseThrow();
            Assertions.assertEquals("minimax-m2.5", plan.modelSwap().newModel());

            Assertions.assertTrue(fx.engine.discardModelSwap("stuck").isPresent());
            Assertions.assertEquals("big-model", fx.settingsStore.load().worker("stuck").orElseThrow().model());
            Assertions.assertTrue(fx.engine.pending("stuck").isEmpty());
            Assertions.assertTrue(fx.engine.discardModelSwap("stuck").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stagnationWithoutUntriedModelOpensRoleVote() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-evo-role-");
        try {
            Fixture fx = new Fixture(root, null);
            fx.saveWorkers(stagnant("minimax-m2.5", List.of()), WorkerDefinition.of("w1", ""), WorkerDefinition.of("w2", ""));
            fx.lower("stuck", Dimension.IMPROVEMENT_RATE);
            fx.lower("stuck", Dimension.OUTPUT_QUALITY);

            EvolutionPlan plan = fx.engine.maybeTrigger("stuck", ThresholdStatus.EVOLVE).orElseThrow();
            Assertions.assertEquals(RemediationPath.ROLE, plan.path());
            Assertions.assertNull(plan.modelSwap());
            Assertions.assertTrue(plan.roleProposal().startsWith("Restrict stuck"));
            Assertions.assertEquals(EvolutionState.AWAITING_VOTE, fx.engine.pending("stuck").orElseThrow().state());
            Assertions.assertEquals(1, fx.engine.pendingVotes().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void roleVoteNeedsQuorumAndApproves() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-evo-vote-approve-");
        try {
            Fixture fx = openRoleVote(root);

            Assertions.assertEquals(VoteOutcome.Status.INELIGIBLE_VOTER, fx.engine.castVote("stuck", "stuck", true).status());
            VoteOutcome first = fx.engine.castVote("stuck", "w1", true);
            Assertions.assertEquals(VoteOutcome.Status.WAITING_FOR_QUORUM, first.status());
            Assertions.assertEquals(2, first.quorum());
            Assertions.assertEquals(VoteOutcome.Status.ALREADY_VOTED, fx.engine.castVote("stuck", "w1", false).status());

            VoteOutcome second = fx.engine.castVote("stuck", "w2", true);
            Assertions.assertEquals(VoteOutcome.Status.APPROVED, second.status());
            Assertions.assertEquals(2, second.votesFor());
            Assertions.assertEquals(1.0, second.approvalRatio());
            Assertions.assertTrue(fx.engine.overrides("stuck").contains("## Role Restructure ("));
            Assertions.assertTrue(fx.engine.pendingVotes().isEmpty());
            Assertions.assertTrue(fx.engine.pending("stuck").isEmpty());
            Assertions.assertEquals(VoteOutcome.Status.NO_PENDING_VOTE, fx.engine.castVote("stuck", "w3", true).status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void roleVoteBelowThresholdIsRejected() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-evo-vote-reject-");
        try {
            Fixture fx = openRoleVote(root);

            fx.engine.castVote("stuck", "w1", true);
            VoteOutcome outcome = fx.engine.castVote("stuck", "w2", false);
            Assertions.assertEquals(VoteOutcome.Status.REJECTED, outcome.status());
            Assertions.assertEquals(0.5, outcome.approvalRatio());
            Assertions.assertEquals(0.6, outcome.threshold());
            Assertions.assertFalse(fx.engine.overrides("stuck").contains("Role Restructure"));
            Assertions.assertTrue(fx.engine.pending("stuck").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentTriggersProduceOnePlan() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-evo-dedup-");
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            Fixture seed = new Fixture(root, null);
            seed.saveWorkers(stagnant("big-model", List.of("small-model")));
            seed.lower("stuck", Dimension.IMPROVEMENT_RATE);
            seed.lower("stuck", Dimension.OUTPUT_QUALITY);

            CountDownLatch start = new CountDownLatch(1);
            List<Future<Optional<EvolutionPlan>>> futures = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                EvolutionEngine engine = new Fixture(root, null).engine;
                futures.add(pool.submit(() -> {
                    start.await();
                    return engine.maybeTrigger("stuck", ThresholdStatus.EVOLVE);
                }));
            }
            start.countDown();

            int plans = 0;
            for (Future<Optional<EvolutionPlan>> future : futures) {
                if (future.get(30, TimeUnit.SECONDS).isPresent()) {
                    plans++;
                }
            }
            Assertions.assertEquals(1, plans);
            Assertions.assertEquals(1, seed.engine.pendingSwaps().size());
            long logged = seed.evolutionLog().tail(100).stream()
                    .filter(row -> "evolution.plan".equals(row.path("action").asText()))
                    .count();
            Assertions.assertEquals(1L, logged);
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void chatSummaryReplacesHeuristicRootCause() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-evo-chat-");
        try {
            List<String> models = new ArrayList<>();
            ChatClient chat = (messages, model) -> {
                models.add(model);
                Assertions.assertEquals("system", messages.get(0).role());
                Assertions.assertTrue(messages.get(1).content().contains("Worker drifter"));
                return "  The role prompt lacks an output format.  ";
            };
            Fixture fx = new Fixture(root, chat);
            fx.lower("drifter", Dimension.CONSISTENCY);

            EvolutionPlan plan = fx.engine.diagnose("drifter");
            Assertions.assertEquals("The role prompt lacks an output format.", plan.rootCause());
            Assertions.assertEquals(List.of("minimax-m2.5"), models);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void chatFailureKeepsHeuristicRootCause() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-evo-chat-fail-");
        try {
            ChatClient chat = (messages, model) -> {
                throw new ChatException("provider unavailable");
            };
            Fixture fx = new Fixture(root, chat);
            fx.lower("drifter", Dimension.CONSISTENCY);

            EvolutionPlan plan = fx.engine.diagnose("drifter");
            Assertions.assertTrue(plan.rootCause().startsWith("Output inconsistency"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void healthyWorkerLosesItsOverrides() throws Exception {
        Path root = Files.createTempDirectory("crewmesh-evo-healthy-");
        try {
            Fixture fx = new Fixture(root, null);
            fx.lower("drifter", Dimension.CONSISTENCY);
            fx.engine.maybeTrigger("drifter", ThresholdStatus.EVOLVE);
            Assertions.assertFalse(fx.engine.overrides("drifter").isEmpty());

            fx.engine.onHealthy("drifter");
            Assertions.assertEquals("", fx.engine.overrides("drifter"));
            Assertions.assertFalse(fx.engine.clearOverrides("drifter"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static Fixture openRoleVote(Path root) {
        Fixture fx = new Fixture(root, null);
        fx.saveWorkers(stagnant("minimax-m2.5", List.of()), WorkerDefinition.of("w1", ""), WorkerDefinition.of("w2", ""));
        fx.lower("stuck", Dimension.IMPROVEMENT_RATE);
        fx.lower("stuck", Dimension.OUTPUT_QUALITY);
        Assertions.assertEquals(RemediationPath.ROLE,
                fx.engine.maybeTrigger("stuck", ThresholdStatus.EVOLVE).orElseThrow().path());
        return fx;
    }

    private static WorkerDefinition stagnant(String model, List<String> fallbacks) {
        return new WorkerDefinition("stuck", "coder", model, fallbacks, null, null, 0L);
    }

    private static final class Fixture {
        final CrewMeshConfig config;
        final MutableClock clock = MutableClock.startingAt(1_700_000_000_000L);
        final TeamSettingsStore settingsStore;
        final WorkQueue queue;
        final ScoreAggregator scorer;
        final EvolutionEngine engine;

        Fixture(Path root, ChatClient chat) {
            this.config = CrewMeshConfig.fromRoot(root.toString());
            this.settingsStore = new TeamSettingsStore(config);
            this.queue = new WorkQueue(config, QueueSettings.defaults(), clock);
            this.scorer = new ScoreAggregator(config, LOCK_TIMEOUT, clock);
            this.engine = new EvolutionEngine(config, scorer, queue, settingsStore,
                    new PromptOverrides(config, LOCK_TIMEOUT, clock), chat, LOCK_TIMEOUT, clock);
        }

        void saveWorkers(WorkerDefinition... workers) {
            settingsStore.save(new TeamSettings(null, null, null, List.of(workers)));
        }

        /**
         * Two zero signals take a neutral dimension from 70 to 34.3.
         */
        void lower(String agentId, Dimension dimension) {
            scorer.update(agentId, dimension, 0.0);
            scorer.update(agentId, dimension, 0.0);
        }

        AuditLogger evolutionLog() {
            return new AuditLogger(config.evolutionLog(), LOCK_TIMEOUT, clock);
        }
    }
}
