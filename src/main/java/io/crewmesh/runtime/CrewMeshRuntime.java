package io.crewmesh.runtime;

import io.crewmesh.agent.ExecutorRegistry;
import io.crewmesh.agent.HeuristicTaskReviewer;
import io.crewmesh.agent.TaskReviewer;
import io.crewmesh.bus.Mailbox;
import io.crewmesh.config.CrewMeshConfig;
import io.crewmesh.config.TeamSettings;
import io.crewmesh.config.TeamSettingsStore;
import io.crewmesh.config.WorkerDefinition;
import io.crewmesh.evolution.EvolutionEngine;
import io.crewmesh.evolution.PromptOverrides;
import io.crewmesh.llm.ChatClient;
import io.crewmesh.model.Task;
import io.crewmesh.reputation.PeerReviewAggregator;
import io.crewmesh.reputation.ReputationScheduler;
import io.crewmesh.reputation.ScoreAggregator;
import io.crewmesh.storage.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires every component over one data root. Settings are read once at construction; model
 * swaps are picked up by the worker loop on its next task.
 */
public final class CrewMeshRuntime {
    private static final Logger LOG = LoggerFactory.getLogger(CrewMeshRuntime.class);

    private final CrewMeshConfig config;
    private final Clock clock;
    private final TeamSettingsStore settingsStore;
    private final TeamSettings settings;
    private final WorkQueue queue;
    private final Mailbox mailbox;
    private final ScoreAggregator scorer;
    private final PeerReviewAggregator peerReviews;
    private final PromptOverrides overrides;
    private final EvolutionEngine evolution;
    private final ReputationScheduler scheduler;
    private final ReviewCoordinator reviews;
    private final ExecutorRegistry executors;
    private final TaskReviewer reviewer;

    public CrewMeshRuntime(CrewMeshConfig config) {
        this(config, Clock.systemUTC(), null, ExecutorRegistry.withDefaults(), new HeuristicTaskReviewer());
    }

    public CrewMeshRuntime(
            CrewMeshConfig config,
            Clock clock,
            ChatClient chat,
            ExecutorRegistry executors,
            TaskReviewer reviewer
    ) {
        this.config = config;
        this.clock = clock;
        this.settingsStore = new TeamSettingsStore(config);
        this.settings = settingsStore.load();
        Duration lockTimeout = settings.queue().lockTimeout();
        this.queue = new WorkQueue(config, settings.queue(), clock);
        this.mailbox = new Mailbox(config, lockTimeout, clock);
        this.scorer = new ScoreAggregator(config, lockTimeout, clock);
        this.peerReviews = new PeerReviewAggregator(config, lockTimeout, clock);
        this.overrides = new PromptOverrides(config, lockTimeout, clock);
        this.evolution = new EvolutionEngine(config, scorer, queue, settingsStore, overrides, chat, lockTimeout, clock);
        this.scheduler = new ReputationScheduler(scorer, evolution);
        this.reviews = new ReviewCoordinator(queue, mailbox, scorer, scheduler, peerReviews, settings.reputation());
        this.executors = executors;
        this.reviewer = reviewer;
    }

    /**
     * Creates the data-root layout and a default settings file when none exists.
     */
    public void init() {
        try {
            for (Path dir : List.of(config.rootDir(), config.queueDir(), config.mailboxDir(), config.reputationDir(),
                    config.pendingDir(), config.swapsDir(), config.votesDir(), config.overridesDir(), config.logsDir())) {
                Files.createDirectories(dir);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize data root: " + config.rootDir(), e);
        }
        if (!Files.exists(config.settingsFile())) {
            settingsStore.save(settings);
            LOG.info("wrote default settings to {}", config.settingsFile());
        }
    }

    public WorkerLoop workerLoop(String workerId) {
        WorkerDefinition worker = settings.worker(workerId).orElseGet(() -> {
            LOG.warn("[{}] not configured in {}, running with defaults", workerId, CrewMeshConfig.SETTINGS_FILE);
            return WorkerDefinition.of(workerId, "");
        });
        return workerLoop(worker);
    }

    public WorkerLoop workerLoop(WorkerDefinition worker) {
        return new WorkerLoop(
                worker,
                queue,
                mailbox,
                scorer,
                scheduler,
                reviews,
                executors.create(worker),
                reviewer,
                overrides,
                settingsStore,
                settings.reputation().minClaimScore(),
                settings.queue().recoveryIntervalMs(),
                clock
        );
    }

    public WorkerRuntime newWorkerRuntime() {
        return newWorkerRuntime(new JavaProcessLauncher(config));
    }

    public WorkerRuntime newWorkerRuntime(ProcessLauncher launcher) {
        return WorkerRuntimes.create(settings.runtime(), launcher, mailbox, this::workerLoop, queue, clock);
    }

    public List<Task> recoverStaleTasks() {
        return queue.recoverStaleTasks();
    }

    public CrewMeshConfig config() {
        return config;
    }

    public TeamSettings settings() {
        return settings;
    }

    public TeamSettingsStore settingsStore() {
        return settingsStore;
    }

    public WorkQueue queue() {
        return queue;
    }

    public Mailbox mailbox() {
        return mailbox;
    }

    public ScoreAggregator scorer() {
        return scorer;
    }

    public PeerReviewAggregator peerReviews() {
        return peerReviews;
    }

    public EvolutionEngine evolution() {
        return evolution;
    }

    public ReputationScheduler scheduler() {
        return scheduler;
    }

    public ReviewCoordinator reviews() {
        return reviews;
    }
}
