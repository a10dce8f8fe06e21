package io.crewmesh.evolution;

import com.fasterxml.jackson.core.type.TypeReference;
import io.crewmesh.config.CrewMeshConfig;
import io.crewmesh.config.TeamSettings;
import io.crewmesh.config.TeamSettingsStore;
import io.crewmesh.config.WorkerDefinition;
import io.crewmesh.llm.ChatClient;
import io.crewmesh.llm.ChatException;
import io.crewmesh.llm.ChatMessage;
import io.crewmesh.model.Task;
import io.crewmesh.model.TaskFlags;
import io.crewmesh.observability.AuditLogger;
import io.crewmesh.reputation.Dimension;
import io.crewmesh.reputation.ScoreAggregator;
import io.crewmesh.reputation.ThresholdListener;
import io.crewmesh.reputation.ThresholdStatus;
import io.crewmesh.reputation.Trend;
import io.crewmesh.storage.AdvisoryLock;
import io.crewmesh.storage.LockedJsonDocument;
import io.crewmesh.storage.WorkQueue;
import io.crewmesh.util.Ids;
import io.crewmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Diagnoses workers whose reputation fell to {@link ThresholdStatus#EVOLVE} and applies one of
 * three remediations.
 *
 * <p>At most one evolution is in flight per worker. The pending marker under
 * {@code evolution/pending/} is checked and written under the worker's lock, so concurrent
 * triggers from several processes produce a single plan. Prompt patches are applied at once;
 * model swaps wait for an operator ({@link #applyModelSwap}); role restructures wait for a team
 * vote ({@link #castVote}).
 */
public final class EvolutionEngine implements ThresholdListener {
    private static final Logger LOG = LoggerFactory.getLogger(EvolutionEngine.class);
    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<Map<String, Object>>() {
    };

    static final int DIAGNOSIS_WINDOW = 50;
    static final double FAILURE_RATE_LIMIT = 0.3;
    static final double REWORK_RATE_LIMIT = 0.2;
    static final double QUALITY_FLOOR = 45.0;
    static final double CONSISTENCY_FLOOR = 45.0;
    static final double IMPROVEMENT_FLOOR = 40.0;

    public static final String HIGH_FAILURE_RATE = "high_failure_rate";
    public static final String FREQUENT_REWORK = "frequent_rework";
    public static final String LOW_OUTPUT_QUALITY = "low_output_quality";
    public static final String INCONSISTENT_OUTPUT = "inconsistent_output";
    public static final String NOT_IMPROVING = "not_improving";

    private final CrewMeshConfig config;
    private final ScoreAggregator scorer;
    private final WorkQueue queue;
    private final TeamSettingsStore settingsStore;
    private final PromptOverrides overrides;
    private final AuditLogger evolutionLog;
    private final ChatClient chat;
    private final Duration lockTimeout;
    private final Clock clock;

    public EvolutionEngine(
            CrewMeshConfig config,
            ScoreAggregator scorer,
            WorkQueue queue,
            TeamSettingsStore settingsStore,
            PromptOverrides overrides,
            ChatClient chat,
            Duration lockTimeout,
            Clock clock
    ) {
        this.config = config;
        this.scorer = scorer;
        this.queue = queue;
        this.settingsStore = settingsStore;
        this.overrides = overrides;
        this.evolutionLog = new AuditLogger(config.evolutionLog(), lockTimeout, clock);
        this.chat = chat;
        this.lockTimeout = lockTimeout;
        this.clock = clock;
    }

    @Override
    public void onHealthy(String agentId) {
        clearOverrides(agentId);
    }

    @Override
    public void onDegraded(String agentId, ThresholdStatus status) {
        maybeTrigger(agentId, status);
    }

    /**
     * Starts an evolution for {@code agentId} when its status is {@link ThresholdStatus#EVOLVE}
     * and none is already in flight. A {@link ThresholdStatus#WARNING} is only logged.
     */
    public Optional<EvolutionPlan> maybeTrigger(String agentId, ThresholdStatus status) {
        if (status == ThresholdStatus.WARNING) {
            LOG.warn("[{}] reputation at warning level ({}), monitoring", agentId, scorer.get(agentId));
            return Optional.empty();
        }
        if (status != ThresholdStatus.EVOLVE) {
            return Optional.empty();
        }
        if (!markPending(agentId)) {
            LOG.debug("[{}] evolution already pending, skipping", agentId);
            return Optional.empty();
        }
        try {
            EvolutionPlan plan = diagnose(agentId);
            execute(plan);
            return Optional.of(plan);
        } catch (RuntimeException e) {
            clearPending(agentId);
            throw e;
        }
    }

    /**
     * Classifies the worker's recent history and reputation into error patterns and picks a
     * remediation path. Every plan is written to the evolution log.
     */
    public EvolutionPlan diagnose(String agentId) {
        List<Task> history = queue.history(agentId, DIAGNOSIS_WINDOW);
        long failures = history.stream().filter(t -> TaskFlags.anyFailure(t.evolutionFlags())).count();
        long reworks = history.stream().filter(t -> TaskFlags.anyRework(t.evolutionFlags())).count();
        int denominator = Math.max(history.size(), 1);
        Map<Dimension, Double> dims = scorer.getAll(agentId);

        List<String> patterns = new ArrayList<>();
        if ((double) failures / denominator > FAILURE_RATE_LIMIT) {
            patterns.add(HIGH_FAILURE_RATE);
        }
        if ((double) reworks / denominator > REWORK_RATE_LIMIT) {
            patterns.add(FREQUENT_REWORK);
        }
        if (dims.get(Dimension.OUTPUT_QUALITY) < QUALITY_FLOOR) {
            patterns.add(LOW_OUTPUT_QUALITY);
        }
        if (dims.get(Dimension.CONSISTENCY) < CONSISTENCY_FLOOR) {
            patterns.add(INCONSISTENT_OUTPUT);
        }
        if (dims.get(Dimension.IMPROVEMENT_RATE) < IMPROVEMENT_FLOOR) {
            patterns.add(NOT_IMPROVING);
        }

        double composite = scorer.get(agentId);
        Trend trend = scorer.trend(agentId);
        TeamSettings settings = settingsStore.load();
        Optional<WorkerDefinition> worker = settings.worker(agentId);
        String currentModel = worker.map(WorkerDefinition::model).orElse("");
        long now = clock.millis();

        RemediationPath path;
        String rootCause;
        ModelSwap swap = null;
        String roleProposal = null;
        if (patterns.contains(NOT_IMPROVING) && patterns.size() >= 2) {
            rootCause = "Worker is not responding to feedback; the current model has reached its ceiling.";
            Optional<String> fallback = fallbackModel(worker, currentModel, settings);
            if (fallback.isPresent()) {
                path = RemediationPath.MODEL;
                swap = new ModelSwap(agentId, fallback.get(), currentModel, rootCause, now);
            } else {
                path = RemediationPath.ROLE;
                rootCause = "Worker is not responding to feedback and no untried fallback model is left.";
                roleProposal = "Restrict " + agentId + " to simpler, well-defined tasks. " + rootCause;
            }
        } else if (patterns.contains(INCONSISTENT_OUTPUT)) {
            path = RemediationPath.PROMPT;
            rootCause = "Output inconsistency suggests an unclear role definition in the prompt.";
        } else if (patterns.contains(HIGH_FAILURE_RATE)) {
            path = RemediationPath.PROMPT;
            rootCause = "High failure rate on task completion; prompt constraints are probably too loose.";
        } else {
            path = RemediationPath.PROMPT;
            rootCause = String.format(Locale.ROOT, "General underperformance. Score: %.1f, trend: %s.",
                    composite, trend.wireName());
        }
        rootCause = summarize(agentId, currentModel, settings, patterns, history.size(), failures, reworks, rootCause);

        EvolutionPlan plan = new EvolutionPlan(
                agentId,
                rootCause,
                patterns,
                path,
                path == RemediationPath.PROMPT ? promptAddition(patterns) : null,
                swap,
                roleProposal,
                patterns.size() >= 2 ? 0.75 : 0.5,
                now
        );
        Map<String, Object> details = new LinkedHashMap<>(Jsons.mapper().convertValue(plan, DETAILS_TYPE));
        details.put("composite", composite);
        details.put("trend", trend.wireName());
        evolutionLog.log(AuditLogger.AuditEvent.of("evolution.plan", "evolution-engine", agentId, path.wireName(), details));
        return plan;
    }

    /**
     * Applies the pending model swap: the worker's model in the settings file is replaced and
     * the swap record and pending marker are removed.
     */
    public Optional<ModelSwap> applyModelSwap(String agentId) {
        Path file = swapFile(agentId);
        try (AdvisoryLock ignored = AdvisoryLock.acquire(CrewMeshConfig.lockFileFor(file), lockTimeout)) {
            Optional<ModelSwap> swap = readJson(file, ModelSwap.class);
            if (swap.isEmpty()) {
                return Optional.empty();
            }
            if (settingsStore.updateWorkerModel(agentId, swap.get().newModel()).isEmpty()) {
                LOG.warn("[{}] not in settings, model swap recorded without a config change", agentId);
            }
            deleteFile(file);
            clearPending(agentId);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("new_model", swap.get().newModel());
            details.put("previous_model", swap.get().previousModel());
            evolutionLog.log(AuditLogger.AuditEvent.of("evolution.model_swap", "operator", agentId, "applied", details));
            LOG.info("[{}] model swapped to {}", agentId, swap.get().newModel());
            return swap;
        }
    }

    public Optional<ModelSwap> discardModelSwap(String agentId) {
        Path file = swapFile(agentId);
        try (AdvisoryLock ignored = AdvisoryLock.acquire(CrewMeshConfig.lockFileFor(file), lockTimeout)) {
            Optional<ModelSwap> swap = readJson(file, ModelSwap.class);
            if (swap.isEmpty()) {
                return Optional.empty();
            }
            deleteFile(file);
            clearPending(agentId);
            evolutionLog.log(AuditLogger.AuditEvent.of("evolution.model_swap", "operator", agentId, "discarded",
                    Map.of("new_model", swap.get().newModel())));
            return swap;
        }
    }

    /**
     * Records one teammate's vote on a pending role restructure. Once a majority of the team has
     * voted, an approval ratio at or above the configured threshold executes the restructure and
     * anything lower discards it.
     */
    public VoteOutcome castVote(String agentId, String voterId, boolean approve) {
        Path file = voteFile(agentId);
        try (AdvisoryLock ignored = AdvisoryLock.acquire(CrewMeshConfig.lockFileFor(file), lockTimeout)) {
            Optional<RoleVote> current = readJson(file, RoleVote.class);
            if (current.isEmpty()) {
                return VoteOutcome.of(agentId, VoteOutcome.Status.NO_PENDING_VOTE);
            }
            if (agentId.equals(voterId)) {
                return VoteOutcome.of(agentId, VoteOutcome.Status.INELIGIBLE_VOTER);
            }
            if (current.get().hasVoted(voterId)) {
                return VoteOutcome.of(agentId, VoteOutcome.Status.ALREADY_VOTED);
            }
            RoleVote vote = current.get().with(voterId, approve);
            TeamSettings settings = settingsStore.load();
            double threshold = settings.reputation().roleVoteThreshold();
            int quorum = Math.max(1, settings.teamSize()) / 2 + 1;
            double ratio = (double) vote.votesFor().size() / vote.totalVotes();
            evolutionLog.log(AuditLogger.AuditEvent.of("evolution.vote", voterId, agentId, approve ? "approve" : "reject",
                    Map.of("votes_for", vote.votesFor().size(), "votes_against", vote.votesAgainst().size())));

            VoteOutcome.Status status;
            if (vote.totalVotes() < quorum) {
                LockedJsonDocument.writeAtomically(file, Jsons.toJson(vote));
                status = VoteOutcome.Status.WAITING_FOR_QUORUM;
            } else if (ratio >= threshold) {
                executeRoleRestructure(vote);
                deleteFile(file);
                clearPending(agentId);
                status = VoteOutcome.Status.APPROVED;
            } else {
                deleteFile(file);
                clearPending(agentId);
                LOG.info("[{}] role restructure rejected by vote ({}/{})", agentId, vote.votesFor().size(), vote.totalVotes());
                status = VoteOutcome.Status.REJECTED;
            }
            return new VoteOutcome(agentId, status, vote.votesFor().size(), vote.votesAgainst().size(),
                    quorum, ratio, threshold);
        }
    }

    public List<RoleVote> pendingVotes() {
        return listJson(config.votesDir(), RoleVote.class);
    }

    public List<ModelSwap> pendingSwaps() {
        return listJson(config.swapsDir(), ModelSwap.class);
    }

    public Optional<PendingEvolution> pending(String agentId) {
        return readJson(pendingFile(agentId), PendingEvolution.class);
    }

    public List<PendingEvolution> pendingEvolutions() {
        return listJson(config.pendingDir(), PendingEvolution.class);
    }

    public String overrides(String agentId) {
        return overrides.read(agentId);
    }

    public boolean clearOverrides(String agentId) {
        boolean cleared = overrides.clear(agentId);
        if (cleared) {
            LOG.info("[{}] reputation healthy again, prompt overrides cleared", agentId);
        }
        return cleared;
    }

    private void execute(EvolutionPlan plan) {
        String agentId = plan.agentId();
        switch (plan.path()) {
            case PROMPT -> {
                boolean appended = overrides.append(agentId, "Evolution Override", plan.promptAddition());
                LOG.info("[{}] prompt patch {} ({})", agentId, appended ? "applied" : "already present",
                        String.join(", ", plan.errorPatterns()));
                clearPending(agentId);
            }
            case MODEL -> {
                LockedJsonDocument.writeAtomically(swapFile(agentId), Jsons.toJson(plan.modelSwap()));
                advancePending(agentId, EvolutionState.AWAITING_CONFIRMATION, RemediationPath.MODEL);
                LOG.warn("[{}] model swap to {} awaiting operator confirmation", agentId, plan.modelSwap().newModel());
            }
            case ROLE -> {
                RoleVote vote = new RoleVote(agentId, plan.roleProposal(), List.of(), List.of(), clock.millis());
                LockedJsonDocument.writeAtomically(voteFile(agentId), Jsons.toJson(vote));
                advancePending(agentId, EvolutionState.AWAITING_VOTE, RemediationPath.ROLE);
                LOG.warn("[{}] role restructure awaiting team vote", agentId);
            }
        }
    }

    private void executeRoleRestructure(RoleVote vote) {
        String body = "Team vote approved a role change.\n"
                + "Reason: " + vote.proposal() + "\n\n"
                + "- Take only simple, well-defined tasks.\n"
                + "- Avoid tasks that need multi-step planning.\n"
                + "- Ask other workers for help when a task is ambiguous.";
        overrides.append(vote.agentId(), "Role Restructure", body);
        evolutionLog.log(AuditLogger.AuditEvent.of("evolution.role_restructure", "team", vote.agentId(), "approved",
                Map.of("votes_for", vote.votesFor(), "votes_against", vote.votesAgainst())));
        LOG.info("[{}] role restructure approved and applied", vote.agentId());
    }

    private Optional<String> fallbackModel(Optional<WorkerDefinition> worker, String currentModel, TeamSettings settings) {
        List<String> candidates = worker.map(WorkerDefinition::fallbackModels)
                .filter(models -> !models.isEmpty())
                .orElse(List.of(settings.reputation().defaultFallbackModel()));
        return candidates.stream()
                .filter(model -> model != null && !model.isBlank())
                .filter(model -> !model.equals(currentModel))
                .findFirst();
    }

    private String summarize(
            String agentId,
            String model,
            TeamSettings settings,
            List<String> patterns,
            int historySize,
            long failures,
            long reworks,
            String heuristic
    ) {
        if (chat == null) {
            return heuristic;
        }
        String prompt = String.format(Locale.ROOT,
                "Worker %s: %d recent tasks, %d failed, %d reworked. Patterns: %s. Heuristic diagnosis: %s%n"
                        + "State the most likely root cause in at most two sentences.",
                agentId, historySize, failures, reworks, patterns.isEmpty() ? "none" : String.join(", ", patterns), heuristic);
        try {
            String summary = chat.chat(List.of(
                    ChatMessage.system("You diagnose underperforming workers in a task-processing team."),
                    ChatMessage.user(prompt)
            ), model.isBlank() ? settings.reputation().defaultFallbackModel() : model);
            return summary == null || summary.isBlank() ? heuristic : summary.strip();
        } catch (ChatException | RuntimeException e) {
            LOG.warn("[{}] diagnosis summary unavailable, using heuristic: {}", agentId, e.getMessage());
            return heuristic;
        }
    }

    static String promptAddition(List<String> patterns) {
        List<String> lines = new ArrayList<>();
        if (patterns.contains(HIGH_FAILURE_RATE)) {
            lines.add("- Before starting a task, state your approach in one sentence.");
            lines.add("- If a task is ambiguous, say what is missing instead of guessing.");
        }
        if (patterns.contains(INCONSISTENT_OUTPUT)) {
            lines.add("- Always follow the output format your role defines.");
            lines.add("- End every response with CONFIDENCE: [0-100] and NEXT: [one sentence].");
        }
        if (patterns.contains(LOW_OUTPUT_QUALITY)) {
            lines.add("- Your recent output quality scores have been low.");
            lines.add("- Focus on correctness and completeness over speed.");
        }
        if (patterns.contains(FREQUENT_REWORK)) {
            lines.add("- Check your result against every requirement of the task before submitting it.");
        }
        if (lines.isEmpty()) {
            lines.add("- Re-read the task description before answering and verify the result against it.");
        }
        return String.join("\n", lines);
    }

    private boolean markPending(String agentId) {
        Path file = pendingFile(agentId);
        try (AdvisoryLock ignored = AdvisoryLock.acquire(CrewMeshConfig.lockFileFor(file), lockTimeout)) {
            if (Files.exists(file)) {
                return false;
            }
            PendingEvolution marker = new PendingEvolution(agentId, EvolutionState.DIAGNOSING, null, clock.millis());
            LockedJsonDocument.writeAtomically(file, Jsons.toJson(marker));
            return true;
        }
    }

    private void advancePending(String agentId, EvolutionState state, RemediationPath path) {
        Path file = pendingFile(agentId);
        try (AdvisoryLock ignored = AdvisoryLock.acquire(CrewMeshConfig.lockFileFor(file), lockTimeout)) {
            PendingEvolution marker = readJson(file, PendingEvolution.class)
                    .orElseGet(() -> new PendingEvolution(agentId, state, path, clock.millis()));
            LockedJsonDocument.writeAtomically(file, Jsons.toJson(marker.advance(state, path)));
        }
    }

    private void clearPending(String agentId) {
        Path file = pendingFile(agentId);
        try (AdvisoryLock ignored = AdvisoryLock.acquire(CrewMeshConfig.lockFileFor(file), lockTimeout)) {
            deleteFile(file);
        }
    }

    private Path pendingFile(String agentId) {
        return config.pendingDir().resolve(agentFileName(agentId));
    }

    private Path swapFile(String agentId) {
        return config.swapsDir().resolve(agentFileName(agentId));
    }

    private Path voteFile(String agentId) {
        return config.votesDir().resolve(agentFileName(agentId));
    }

    private static String agentFileName(String agentId) {
        return Ids.requireSafe(agentId, "worker id") + ".json";
    }

    private static <T> Optional<T> readJson(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(Jsons.mapper().readValue(Files.readString(file, StandardCharsets.UTF_8), type));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + file, e);
        }
    }

    private static <T> List<T> listJson(Path dir, Class<T> type) {
        List<T> items = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return items;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json")) {
            for (Path path : stream) {
                readJson(path, type).ifPresent(items::add);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list " + dir, e);
        }
        return items;
    }

    private static void deleteFile(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete " + file, e);
        }
    }
}
