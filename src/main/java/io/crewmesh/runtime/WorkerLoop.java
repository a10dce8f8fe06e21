package io.crewmesh.runtime;

import io.crewmesh.agent.ExecutionContext;
import io.crewmesh.agent.TaskExecutor;
import io.crewmesh.agent.TaskOutcome;
import io.crewmesh.agent.TaskReviewer;
import io.crewmesh.bus.Mailbox;
import io.crewmesh.config.TeamSettingsStore;
import io.crewmesh.config.WorkerDefinition;
import io.crewmesh.evolution.PromptOverrides;
import io.crewmesh.model.MailboxMessage;
import io.crewmesh.model.MessageType;
import io.crewmesh.model.Task;
import io.crewmesh.reputation.ReputationScheduler;
import io.crewmesh.reputation.ScoreAggregator;
import io.crewmesh.storage.LockTimeoutException;
import io.crewmesh.storage.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * The control flow of one worker: recover stale leases, drain the mailbox, claim, execute and
 * hand the result to review. {@link #tick()} never sleeps, so the same loop runs inside a
 * dedicated process or on the shared cooperative scheduler.
 */
public final class WorkerLoop implements WorkerTick {
    private static final Logger LOG = LoggerFactory.getLogger(WorkerLoop.class);

    private final WorkerDefinition worker;
    private final WorkQueue queue;
    private final Mailbox mailbox;
    private final ScoreAggregator scorer;
    private final ReputationScheduler scheduler;
    private final ReviewCoordinator reviews;
    private final TaskExecutor executor;
    private final TaskReviewer reviewer;
    private final PromptOverrides overrides;
    private final TeamSettingsStore settingsStore;
    private final double minClaimScore;
    private final long recoveryIntervalMs;
    private final Clock clock;
    private long lastRecoveryMs;

    public WorkerLoop(
            WorkerDefinition worker,
            WorkQueue queue,
            Mailbox mailbox,
            ScoreAggregator scorer,
            ReputationScheduler scheduler,
            ReviewCoordinator reviews,
            TaskExecutor executor,
            TaskReviewer reviewer,
            PromptOverrides overrides,
            TeamSettingsStore settingsStore,
            double minClaimScore,
            long recoveryIntervalMs,
            Clock clock
    ) {
        this.worker = worker;
        this.queue = queue;
        this.mailbox = mailbox;
        this.scorer = scorer;
        this.scheduler = scheduler;
        this.reviews = reviews;
        this.executor = executor;
        this.reviewer = reviewer;
        this.overrides = overrides;
        this.settingsStore = settingsStore;
        this.minClaimScore = minClaimScore;
        this.recoveryIntervalMs = recoveryIntervalMs;
        this.clock = clock;
        this.lastRecoveryMs = Long.MIN_VALUE;
    }

    public String workerId() {
        return worker.id();
    }

    @Override
    public TickResult tick() {
        try {
            maybeRecoverStaleTasks();
            MailboxOutcome mail = handleMailbox();
            if (mail.shutdown()) {
                LOG.info("[{}] shutdown requested", worker.id());
                return TickResult.SHUTDOWN;
            }
            TickResult idle = mail.reviewed() ? TickResult.REVIEWED : TickResult.IDLE;
            if (mail.deferred()) {
                return idle;
            }

            double reputation = scorer.get(worker.id());
            if (reputation < minClaimScore) {
                LOG.debug("[{}] reputation {} below claim floor {}", worker.id(), reputation, minClaimScore);
                return idle;
            }
            Optional<Task> claimed = queue.claimNext(worker.id(), reputation, worker.role());
            if (claimed.isEmpty()) {
                return idle;
            }
            work(claimed.get());
            return TickResult.WORKED;
        } catch (LockTimeoutException e) {
            LOG.warn("[{}] {}; retrying next cycle", worker.id(), e.getMessage());
            return TickResult.IDLE;
        }
    }

    /**
     * Drives {@link #tick()} until a shutdown message arrives or {@code running} turns false,
     * sleeping {@code pollIntervalMs} after idle cycles.
     */
    public void runUntilStopped(BooleanSupplier running, long pollIntervalMs) {
        LOG.info("[{}] worker loop started", worker.id());
        while (running.getAsBoolean()) {
            TickResult result = tick();
            if (result == TickResult.SHUTDOWN) {
                break;
            }
            if (result == TickResult.IDLE) {
                try {
                    Thread.sleep(pollIntervalMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        LOG.info("[{}] worker loop stopped", worker.id());
    }

    /**
     * Handles the drained mailbox one message at a time. A shutdown anywhere in the batch is
     * honoured. When a lock times out, the messages not yet handled go back to the mailbox.
     */
    private MailboxOutcome handleMailbox() {
        List<MailboxMessage> inbox = mailbox.readAndDrain(worker.id());
        boolean shutdown = inbox.stream().anyMatch(m -> m.type() == MessageType.SHUTDOWN);
        boolean reviewed = false;
        for (int i = 0; i < inbox.size(); i++) {
            MailboxMessage message = inbox.get(i);
            try {
                switch (message.type()) {
                    case SHUTDOWN -> {
                    }
                    case REVIEW_REQUEST -> reviewed |= reviews.handleReviewRequest(worker.id(), reviewer, message).isPresent();
                    case MESSAGE -> LOG.info("[{}] message from {}: {}", worker.id(), message.from(), message.content());
                }
            } catch (LockTimeoutException e) {
                LOG.warn("[{}] {}; keeping {} message(s) for the next cycle", worker.id(), e.getMessage(), inbox.size() - i);
                mailbox.requeue(worker.id(), inbox.subList(i, inbox.size()).stream()
                        .filter(m -> m.type() != MessageType.SHUTDOWN)
                        .toList());
                return new MailboxOutcome(shutdown, reviewed, true);
            } catch (RuntimeException e) {
                LOG.error("[{}] dropping {} message from {}", worker.id(), message.type().wireName(), message.from(), e);
            }
        }
        return new MailboxOutcome(shutdown, reviewed, false);
    }

    private void work(Task task) {
        WorkerDefinition current = settingsStore.load().worker(worker.id()).orElse(worker);
        LOG.info("[{}] claimed {}", worker.id(), task.id());
        ExecutionContext context = new ExecutionContext(
                worker.id(),
                current.role(),
                current.model(),
                task.id(),
                task.description(),
                overrides.read(worker.id())
        );
        TaskOutcome outcome;
        try {
            outcome = executor.execute(context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = TaskOutcome.fail("interrupted", "execution interrupted");
        } catch (Exception e) {
            outcome = TaskOutcome.fail(e.getClass().getSimpleName(), String.valueOf(e.getMessage()));
        }
        if (outcome == null) {
            outcome = TaskOutcome.fail("no_outcome", "executor returned no outcome");
        }

        if (outcome.success()) {
            String result = outcome.output() == null ? "" : outcome.output();
            if (!queue.submitForReview(task.id(), result)) {
                LOG.warn("[{}] lost ownership of {} before submitting", worker.id(), task.id());
                return;
            }
            scheduler.onTaskComplete(worker.id(), task.id(), result, task.evolutionFlags());
            reviews.requestReview(worker.id(), task, result);
        } else {
            queue.fail(task.id(), outcome.errorClass());
            scheduler.onError(worker.id(), task.id(), outcome.error());
        }
    }

    private record MailboxOutcome(boolean shutdown, boolean reviewed, boolean deferred) {
    }

    private void maybeRecoverStaleTasks() {
        long now = clock.millis();
        if (lastRecoveryMs != Long.MIN_VALUE && now - lastRecoveryMs < recoveryIntervalMs) {
            return;
        }
        lastRecoveryMs = now;
        List<Task> recovered = queue.recoverStaleTasks();
        if (!recovered.isEmpty()) {
            LOG.info("[{}] returned {} stale task(s) to the queue", worker.id(), recovered.size());
        }
    }
}
