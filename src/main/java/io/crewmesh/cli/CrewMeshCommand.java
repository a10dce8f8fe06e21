package io.crewmesh.cli;

import io.crewmesh.config.CrewMeshConfig;
import io.crewmesh.evolution.EvolutionEngine;
import io.crewmesh.evolution.ModelSwap;
import io.crewmesh.evolution.VoteOutcome;
import io.crewmesh.model.MailboxMessage;
import io.crewmesh.model.MessageType;
import io.crewmesh.model.Task;
import io.crewmesh.model.TaskStatus;
import io.crewmesh.reputation.Dimension;
import io.crewmesh.reputation.ReputationEntry;
import io.crewmesh.reputation.ScoreAggregator;
import io.crewmesh.runtime.CrewMeshRuntime;
import io.crewmesh.runtime.WorkerLoop;
import io.crewmesh.runtime.WorkerRuntime;
import io.crewmesh.storage.WorkQueue;
import io.crewmesh.util.Jsons;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;

@Command(
        name = "crewmesh",
        mixinStandardHelpOptions = true,
        description = "CrewMesh single-host worker fleet CLI",
        subcommands = {
                CrewMeshCommand.InitCommand.class,
                CrewMeshCommand.SubmitCommand.class,
                CrewMeshCommand.TasksCommand.class,
                CrewMeshCommand.TaskCommand.class,
                CrewMeshCommand.CancelCommand.class,
                CrewMeshCommand.PauseCommand.class,
                CrewMeshCommand.ResumeCommand.class,
                CrewMeshCommand.RetryCommand.class,
                CrewMeshCommand.RecoverCommand.class,
                CrewMeshCommand.HistoryCommand.class,
                CrewMeshCommand.ReputationCommand.class,
                CrewMeshCommand.WorkerCommand.class,
                CrewMeshCommand.RunCommand.class,
                CrewMeshCommand.EvolutionCommand.class,
                CrewMeshCommand.ApplySwapCommand.class,
                CrewMeshCommand.DiscardSwapCommand.class,
                CrewMeshCommand.VoteCommand.class,
                CrewMeshCommand.SendCommand.class
        }
)
public final class CrewMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = CrewMeshConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | submit | tasks | task | cancel | pause | resume | retry | recover | history | reputation | worker | run | evolution | apply-swap | discard-swap | vote | send");
    }

    CrewMeshRuntime runtime() {
        CrewMeshRuntime runtime = new CrewMeshRuntime(CrewMeshConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    static int printTask(Optional<Task> task) {
        if (task.isEmpty()) {
            System.out.println("{\"error\":\"task not found\"}");
            return 1;
        }
        System.out.println(Jsons.toJson(task.get()));
        return 0;
    }

    static int printChange(String taskId, String action, boolean changed) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("task_id", taskId);
        out.put("action", action);
        out.put("changed", changed);
        System.out.println(Jsons.toJson(out));
        return changed ? 0 : 1;
    }

    @Command(name = "init", description = "Create the data root and a default settings file")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        CrewMeshCommand parent;

        @Override
        public Integer call() {
            CrewMeshRuntime runtime = parent.runtime();
            System.out.println("Initialized CrewMesh at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "submit", description = "Add a task to the shared queue")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        CrewMeshCommand parent;

        @Parameters(index = "0", description = "Task description")
        String description;

        @Option(names = {"--blocked-by"}, split = ",", description = "Task ids that must complete first")
        List<String> blockedBy = new ArrayList<>();

        @Option(names = {"--role"}, description = "Role keyword a worker must match to claim the task")
        String role;

        @Override
        public Integer call() {
            Task task = parent.runtime().queue().create(description, blockedBy, role);
            System.out.println(Jsons.toJson(task));
            return 0;
        }
    }

    @Command(name = "tasks", description = "List tasks, optionally by status")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        CrewMeshCommand parent;

        @Option(names = {"--status"}, description = "pending|claimed|review|completed|failed|blocked|paused|cancelled")
        String status;

        @Override
        public Integer call() {
            WorkQueue queue = parent.runtime().queue();
            List<Task> tasks = status == null ? queue.list() : queue.list(TaskStatus.fromString(status));
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("counts", queue.countsByStatus());
            out.put("tasks", tasks);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "task", description = "Show one task")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        CrewMeshCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            return printTask(parent.runtime().queue().get(taskId));
        }
    }

    abstract static class TaskTransitionCommand implements Callable<Integer> {
        @ParentCommand
        CrewMeshCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        abstract String action();

        abstract boolean apply(WorkQueue queue, String taskId);

        @Override
        public Integer call() {
            return printChange(taskId, action(), apply(parent.runtime().queue(), taskId));
        }
    }

    @Command(name = "cancel", description = "Cancel a task that has not finished")
    static final class CancelCommand extends TaskTransitionCommand {
        @Override
        String action() {
            return "cancel";
        }

        @Override
        boolean apply(WorkQueue queue, String taskId) {
            return queue.cancel(taskId);
        }
    }

    @Command(name = "pause", description = "Hold a pending task back from claiming")
    static final class PauseCommand extends TaskTransitionCommand {
        @Override
        String action() {
            return "pause";
        }

        @Override
        boolean apply(WorkQueue queue, String taskId) {
            return queue.pause(taskId);
        }
    }

    @Command(name = "resume", description = "Return a paused task to the queue")
    static final class ResumeCommand extends TaskTransitionCommand {
        @Override
        String action() {
            return "resume";
        }

        @Override
        boolean apply(WorkQueue queue, String taskId) {
            return queue.resume(taskId);
        }
    }

    @Command(name = "retry", description = "Requeue a failed or cancelled task")
    static final class RetryCommand extends TaskTransitionCommand {
        @Override
        String action() {
            return "retry";
        }

        @Override
        boolean apply(WorkQueue queue, String taskId) {
            return queue.retry(taskId);
        }
    }

    @Command(name = "recover", description = "Return tasks with expired leases to the queue")
    static final class RecoverCommand implements Callable<Integer> {
        @ParentCommand
        CrewMeshCommand parent;

        @Override
        public Integer call() {
            List<Task> recovered = parent.runtime().recoverStaleTasks();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("recovered", recovered.size());
            out.put("tasks", recovered.stream().map(Task::id).toList());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "history", description = "Show tasks a worker has handled, most recent first")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        CrewMeshCommand parent;

        @Parameters(index = "0", description = "Worker id")
        String agentId;

        @Option(names = {"--last"}, defaultValue = "20", description = "Max number of tasks")
        int last;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().queue().history(agentId, last)));
            return 0;
        }
    }

    @Command(name = "reputation", description = "Show reputation for one worker or all of them")
    static final class ReputationCommand implements Callable<Integer> {
        @ParentCommand
        CrewMeshCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Worker id")
        String agentId;

        @Override
        public Integer call() {
            ScoreAggregator scorer = parent.runtime().scorer();
            if (agentId == null) {
                Map<String, Object> all = new LinkedHashMap<>();
                for (String id : scorer.entries().keySet()) {
                    all.put(id, summary(scorer, id));
                }
                System.out.println(Jsons.toJson(all));
                return 0;
            }
            System.out.println(Jsons.toJson(summary(scorer, agentId)));
            return 0;
        }

        private static Map<String, Object> summary(ScoreAggregator scorer, String agentId) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("agent_id", agentId);
            out.put("composite", scorer.get(agentId));
            Map<String, Double> dimensions = new LinkedHashMap<>();
            for (Map.Entry<Dimension, Double> entry : scorer.getAll(agentId).entrySet()) {
                dimensions.put(entry.getKey().wireName(), entry.getValue());
            }
            out.put("dimensions", dimensions);
            out.put("status", scorer.thresholdStatus(agentId));
            out.put("trend", scorer.trend(agentId));
            out.put("samples", scorer.entry(agentId).map(ReputationEntry::history).map(List::size).orElse(0));
            return out;
        }
    }

    @Command(name = "worker", description = "Run one worker loop in this process")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        CrewMeshCommand parent;

        @Option(names = {"--worker-id"}, required = true, description = "Worker identity")
        String workerId;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run only one cycle")
        boolean once;

        @Override
        public Integer call() {
            CrewMeshRuntime runtime = parent.runtime();
            WorkerLoop loop = runtime.workerLoop(workerId);
            if (once) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("worker_id", workerId);
                out.put("result", loop.tick());
                System.out.println(Jsons.toJson(out));
                return 0;
            }
            AtomicBoolean running = new AtomicBoolean(true);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> running.set(false), "crewmesh-worker-shutdown-hook"));
            loop.runUntilStopped(running::get, runtime.settings().runtime().pollIntervalMs());
            return 0;
        }
    }

    @Command(name = "run", description = "Start the configured worker runtime until interrupted")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        CrewMeshCommand parent;

        @Override
        public Integer call() throws Exception {
            CrewMeshRuntime runtime = parent.runtime();
            if (runtime.settings().workers().isEmpty()) {
                System.out.println("{\"error\":\"no workers configured in " + CrewMeshConfig.SETTINGS_FILE + "\"}");
                return 1;
            }
            long pollIntervalMs = runtime.settings().runtime().pollIntervalMs();
            AtomicBoolean running = new AtomicBoolean(true);
            try (WorkerRuntime workers = runtime.newWorkerRuntime()) {
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    running.set(false);
                    workers.stopAll();
                }, "crewmesh-run-shutdown-hook"));
                workers.startAll(runtime.settings().workers());
                System.out.println(Jsons.toJson(workers.allAlive()));
                while (running.get()) {
                    int pruned = workers.pruneDead();
                    if (pruned > 0) {
                        System.out.println(Jsons.toJson(workers.allAlive()));
                    }
                    Thread.sleep(pollIntervalMs);
                }
            }
            return 0;
        }
    }

    @Command(name = "evolution", description = "Show pending evolutions, model swaps and role votes")
    static final class EvolutionCommand implements Callable<Integer> {
        @ParentCommand
        CrewMeshCommand parent;

        @Option(names = {"--overrides"}, description = "Also print the prompt overrides of this worker")
        String overridesFor;

        @Override
        public Integer call() {
            EvolutionEngine evolution = parent.runtime().evolution();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("pending", evolution.pendingEvolutions());
            out.put("swaps", evolution.pendingSwaps());
            out.put("votes", evolution.pendingVotes());
            if (overridesFor != null) {
                out.put("overrides", evolution.overrides(overridesFor));
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    abstract static class SwapDecisionCommand implements Callable<Integer> {
        @ParentCommand
        CrewMeshCommand parent;

        @Parameters(index = "0", description = "Worker id")
        String agentId;

        abstract BiFunction<EvolutionEngine, String, Optional<ModelSwap>> decision();

        @Override
        public Integer call() {
            Optional<ModelSwap> swap = decision().apply(parent.runtime().evolution(), agentId);
            if (swap.isEmpty()) {
                System.out.println("{\"error\":\"no pending model swap\"}");
                return 1;
            }
            System.out.println(Jsons.toJson(swap.get()));
            return 0;
        }
    }

    @Command(name = "apply-swap", description = "Confirm a proposed model swap and write it to settings")
    static final class ApplySwapCommand extends SwapDecisionCommand {
        @Override
        BiFunction<EvolutionEngine, String, Optional<ModelSwap>> decision() {
            return EvolutionEngine::applyModelSwap;
        }
    }

    @Command(name = "discard-swap", description = "Drop a proposed model swap")
    static final class DiscardSwapCommand extends SwapDecisionCommand {
        @Override
        BiFunction<EvolutionEngine, String, Optional<ModelSwap>> decision() {
            return EvolutionEngine::discardModelSwap;
        }
    }

    @Command(name = "vote", description = "Vote on a proposed role change")
    static final class VoteCommand implements Callable<Integer> {
        @ParentCommand
        CrewMeshCommand parent;

        @Parameters(index = "0", description = "Worker under vote")
        String agentId;

        @Option(names = {"--voter"}, required = true, description = "Voting worker id")
        String voterId;

        @ArgGroup(exclusive = true, multiplicity = "1")
        Choice choice;

        static final class Choice {
            @Option(names = {"--approve"}, description = "Vote for the role change")
            boolean approve;

            @Option(names = {"--reject"}, description = "Vote against the role change")
            boolean reject;
        }

        @Override
        public Integer call() {
            VoteOutcome outcome = parent.runtime().evolution().castVote(agentId, voterId, choice.approve);
            System.out.println(Jsons.toJson(outcome));
            return switch (outcome.status()) {
                case ALREADY_VOTED, INELIGIBLE_VOTER, NO_PENDING_VOTE -> 1;
                default -> 0;
            };
        }
    }

    @Command(name = "send", description = "Append a message to a worker mailbox")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        CrewMeshCommand parent;

        @Parameters(index = "0", description = "Recipient worker id")
        String toId;

        @Parameters(index = "1", description = "Message content")
        String content;

        @Option(names = {"--type"}, defaultValue = "message", description = "message|shutdown|review_request")
        String type;

        @Option(names = {"--from"}, defaultValue = "cli", description = "Sender id")
        String fromId;

        @Override
        public Integer call() {
            MailboxMessage sent = parent.runtime().mailbox().send(toId, fromId, MessageType.fromString(type), content);
            System.out.println(Jsons.toJson(sent));
            return 0;
        }
    }
}
