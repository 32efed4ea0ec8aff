package com.taskloop.core.engine;

import com.taskloop.core.TaskloopException;
import com.taskloop.core.agent.AgentInvoker;
import com.taskloop.core.agent.AgentRequest;
import com.taskloop.core.agent.AgentResult;
import com.taskloop.core.agent.PromptBuilder;
import com.taskloop.core.events.EventBus;
import com.taskloop.core.events.LoopEvent;
import com.taskloop.core.gate.GateRunner;
import com.taskloop.core.logging.MdcContext;
import com.taskloop.core.metrics.LoopMetrics;
import com.taskloop.core.model.EffectiveConfig;
import com.taskloop.core.model.GateResult;
import com.taskloop.core.model.IterationOutcome;
import com.taskloop.core.model.IterationResult;
import com.taskloop.core.model.LoopOutcome;
import com.taskloop.core.model.LoopPhase;
import com.taskloop.core.model.SelectedTask;
import com.taskloop.core.model.TaskCounts;
import com.taskloop.core.model.TerminalState;
import com.taskloop.core.state.BlockedTask;
import com.taskloop.core.state.RunState;
import com.taskloop.core.state.RunStateStore;
import com.taskloop.core.tracker.PartialUpdateException;
import com.taskloop.core.tracker.TaskNotFoundException;
import com.taskloop.core.tracker.TaskTracker;
import com.taskloop.core.tracker.TrackerNetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-run iteration state machine:
 * {@code IDLE -> SELECT -> EXECUTE -> GATE -> COMMIT | ROLLBACK -> IDLE}.
 * <p>
 * A task is committed only when the agent succeeded and every gate of the iteration passed.
 * Any other ending leaves the task open in the tracker. Tracker network failures during
 * selection or commit become failed iterations rather than crashes.
 * <p>
 * Failed iterations count against their task; a task that reaches the attempt limit is
 * blocked in the state file and in the tracker. With an hourly limit set, the loop waits
 * before an iteration that would exceed it.
 */
public class IterationController {

    private static final Logger log = LoggerFactory.getLogger(IterationController.class);

    private static final Duration HOUR = Duration.ofHours(1);

    private final String runId;
    private final EffectiveConfig config;
    private final TaskTracker tracker;
    private final AgentInvoker agent;
    private final GateRunner gateRunner;
    private final RunStateStore stateStore;
    private final EventBus eventBus;
    private final LoopMetrics metrics;
    private final RunControl control;
    private final Clock clock;
    private final Path projectRoot;

    private volatile LoopPhase phase = LoopPhase.IDLE;

    public IterationController(String runId, EffectiveConfig config, TaskTracker tracker, AgentInvoker agent,
                               GateRunner gateRunner, RunStateStore stateStore, EventBus eventBus,
                               LoopMetrics metrics, RunControl control, Clock clock, Path projectRoot) {
        this.runId = runId;
        this.config = config;
        this.tracker = tracker;
        this.agent = agent;
        this.gateRunner = gateRunner;
        this.stateStore = stateStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.control = control;
        this.clock = clock;
        this.projectRoot = projectRoot;
    }

    public LoopPhase phase() {
        return phase;
    }

    public String runId() {
        return runId;
    }

    /**
     * Runs iterations until the backlog is done or blocked, the no-progress limit or the
     * iteration cap is reached, or a stop is requested.
     */
    public LoopOutcome run() {
        MdcContext.setRun(runId);
        publish(LoopEvent.RUN_STARTED, null, Map.of(
                "mode", config.mode(),
                "maxIterations", config.maxIterations(),
                "tracker", tracker.kind()));
        log.info("Run {} started: mode={}, maxIterations={}, tracker={}", runId, config.mode(),
                config.maxIterations(), tracker.kind());

        var results = new ArrayList<IterationResult>();
        TerminalState terminal = TerminalState.LIMIT_REACHED;
        try {
            for (int i = 0; i < config.maxIterations(); i++) {
                if (!control.checkpoint() || !awaitHourlyBudget()) {
                    terminal = TerminalState.STOPPED;
                    break;
                }
                Optional<IterationResult> maybeResult = runIteration();
                if (maybeResult.isEmpty()) {
                    terminal = TerminalState.STOPPED;
                    break;
                }
                IterationResult result = maybeResult.get();
                results.add(result);

                if (result.outcome() == IterationOutcome.NO_TASK) {
                    terminal = TerminalState.DONE;
                    break;
                }
                if (result.outcome() == IterationOutcome.BLOCKED) {
                    terminal = TerminalState.BLOCKED;
                    break;
                }
                if (result.committed() && backlogEmpty()) {
                    terminal = TerminalState.DONE;
                    break;
                }
                int streak = stateStore.load().noProgressStreak();
                if (streak >= config.noProgressLimit()) {
                    log.warn("No progress in {} consecutive iteration(s); stopping", streak);
                    terminal = TerminalState.NO_PROGRESS;
                    break;
                }
                boolean more = i + 1 < config.maxIterations();
                if (more && config.sleepSecondsBetweenIterations() > 0
                        && !control.sleep(Duration.ofSeconds(config.sleepSecondsBetweenIterations()))) {
                    terminal = TerminalState.STOPPED;
                    break;
                }
            }
        } finally {
            phase = LoopPhase.IDLE;
        }

        var outcome = new LoopOutcome(runId, terminal, results);
        metrics.recordRunFinished(terminal.name());
        publish(LoopEvent.RUN_STOPPED, null, Map.of(
                "terminalState", terminal.name(),
                "iterations", results.size(),
                "tasksCompleted", outcome.tasksCompleted(),
                "exitCode", outcome.exitCode()));
        log.info("Run {} finished: {} after {} iteration(s), {} task(s) completed", runId, terminal,
                results.size(), outcome.tasksCompleted());
        MdcContext.clear();
        return outcome;
    }

    /**
     * Runs exactly one iteration.
     *
     * @return the result, or empty when a stop arrived after selection and before the agent ran
     */
    public Optional<IterationResult> runIteration() {
        RunState state = stateStore.load();
        int iteration = state.lastIteration() + 1;
        int streak = state.noProgressStreak();
        Instant startedAt = clock.instant();
        MdcContext.setIteration(runId, iteration);
        try {
            phase = LoopPhase.SELECT;
            publish(LoopEvent.ITERATION_STARTED, null, Map.of("iteration", iteration));

            Set<String> skipIds = config.skipBlockedTasks() ? state.blockedTasks().keySet() : Set.of();
            Optional<SelectedTask> selected;
            try {
                selected = tracker.claimNextTask(skipIds);
            } catch (TrackerNetworkException e) {
                log.warn("Task selection failed: {}", e.getMessage());
                return Optional.of(finish(iteration, null, IterationOutcome.FAILED, List.of(),
                        "Task selection failed: " + e.getMessage(), null, false, startedAt, streak));
            }

            if (selected.isEmpty()) {
                return Optional.of(nothingSelected(iteration, startedAt, streak));
            }

            SelectedTask task = selected.get();
            MdcContext.setTask(task.id());
            log.info("Iteration {}: task {} ({})", iteration, task.id(), task.title());

            if (!control.checkpoint()) {
                log.info("Stop requested before the agent ran; task {} left untouched", task.id());
                publish(LoopEvent.ITERATION_FINISHED, task.id(), Map.of("iteration", iteration, "outcome", "stopped"));
                return Optional.empty();
            }

            tracker.markTaskStarted(task.id());
            IterationResult result = execute(iteration, task, startedAt, streak);
            if (!result.committed()) {
                tracker.markTaskAbandoned(task.id());
                blockIfExhausted(task, result);
            }
            return Optional.of(result);
        } finally {
            phase = LoopPhase.IDLE;
            MdcContext.clearTask();
        }
    }

    private IterationResult execute(int iteration, SelectedTask task, Instant startedAt, int streak) {
        phase = LoopPhase.EXECUTE;
        var request = new AgentRequest(task, projectRoot, PromptBuilder.build(task.task(), streak),
                Duration.ofSeconds(config.runnerTimeoutSeconds()), iteration);
        AgentResult agentResult = agent.invoke(request);
        if (!agentResult.succeeded()) {
            String reason = agentResult.timedOut()
                    ? "Agent timed out after %ds".formatted(config.runnerTimeoutSeconds())
                    : "Agent exited with status %d".formatted(agentResult.exitCode());
            log.warn("{}; skipping gates, task {} stays open", reason, task.id());
            return finish(iteration, task, IterationOutcome.FAILED, List.of(), reason,
                    agentResult.exitCode(), agentResult.timedOut(), startedAt, streak);
        }

        phase = LoopPhase.GATE;
        List<GateResult> gateResults = gateRunner.runAll(config.gates());
        List<String> failed = gateResults.stream().filter(g -> !g.passed()).map(GateResult::name).toList();
        if (!failed.isEmpty()) {
            phase = LoopPhase.ROLLBACK;
            String reason = "Gate(s) failed: " + String.join(", ", failed);
            log.warn("{}; task {} stays open", reason, task.id());
            return finish(iteration, task, IterationOutcome.FAILED, gateResults, reason,
                    agentResult.exitCode(), false, startedAt, streak);
        }

        phase = LoopPhase.COMMIT;
        String summary = commitSummary(iteration, task, gateResults);
        try {
            tracker.markTaskDone(task.id(), summary);
        } catch (PartialUpdateException | TrackerNetworkException | TaskNotFoundException e) {
            log.error("Commit of task {} failed: {}", task.id(), e.getMessage());
            return finish(iteration, task, IterationOutcome.FAILED, gateResults,
                    "Commit failed: " + e.getMessage(), agentResult.exitCode(), false, startedAt, streak);
        }
        return finish(iteration, task, IterationOutcome.DONE, gateResults, summary,
                agentResult.exitCode(), false, startedAt, streak);
    }

    private void blockIfExhausted(SelectedTask task, IterationResult result) {
        int limit = config.maxAttemptsPerTask();
        if (limit <= 0) {
            return;
        }
        int attempts = stateStore.load().attemptsFor(task.id());
        if (attempts < limit) {
            return;
        }
        String reason = result.commentText() != null ? result.commentText() : "iteration failed";
        stateStore.markBlocked(task.id(), new BlockedTask(clock.instant(), attempts, reason));
        boolean flagged;
        try {
            flagged = tracker.blockTask(task.id(), "Blocked after %d failed attempt(s): %s".formatted(attempts, reason));
        } catch (TaskloopException e) {
            log.warn("Could not block task {} in the tracker: {}", task.id(), e.getMessage());
            flagged = false;
        }
        log.warn("Task {} blocked after {} failed attempt(s): {}", task.id(), attempts, reason);
        publish(LoopEvent.TASK_BLOCKED, task.id(), Map.of(
                "attempts", attempts,
                "reason", reason,
                "trackerUpdated", flagged));
    }

    /**
     * Waits until one more agent invocation fits the hourly limit.
     *
     * @return false when a stop arrived while waiting
     */
    private boolean awaitHourlyBudget() {
        int limit = config.rateLimitPerHour();
        if (limit <= 0) {
            return true;
        }
        Instant now = clock.instant();
        List<Instant> recent = stateStore.load().agentInvocationsSince(now.minus(HOUR));
        if (recent.size() < limit) {
            return true;
        }
        Instant freesAt = recent.get(recent.size() - limit).plus(HOUR);
        Duration wait = Duration.between(now, freesAt);
        if (wait.isNegative() || wait.isZero()) {
            return true;
        }
        log.info("{} agent invocation(s) in the last hour (limit {}); waiting {}s", recent.size(), limit,
                wait.toSeconds());
        publish(LoopEvent.RUN_THROTTLED, null, Map.of(
                "invocationsLastHour", recent.size(),
                "limit", limit,
                "waitSeconds", wait.toSeconds()));
        return control.sleep(wait);
    }

    private IterationResult nothingSelected(int iteration, Instant startedAt, int streak) {
        TaskCounts counts;
        try {
            counts = tracker.counts();
        } catch (TrackerNetworkException e) {
            log.warn("Could not count tasks: {}", e.getMessage());
            return finish(iteration, null, IterationOutcome.FAILED, List.of(),
                    "Task count failed: " + e.getMessage(), null, false, startedAt, streak);
        }
        if (counts.open() == 0) {
            log.info("All {} task(s) complete", counts.total());
            return finish(iteration, null, IterationOutcome.NO_TASK, List.of(),
                    "All tasks complete", null, false, startedAt, streak);
        }
        log.warn("{} open task(s), none eligible", counts.open());
        return finish(iteration, null, IterationOutcome.BLOCKED, List.of(),
                "%d open task(s), none eligible".formatted(counts.open()), null, false, startedAt, streak);
    }

    private IterationResult finish(int iteration, SelectedTask task, IterationOutcome outcome,
                                   List<GateResult> gateResults, String comment, Integer agentExitCode,
                                   boolean agentTimedOut, Instant startedAt, int streak) {
        var result = new IterationResult(iteration,
                task != null ? task.id() : null,
                task != null ? task.title() : null,
                outcome, gateResults, comment, agentExitCode, agentTimedOut, startedAt, clock.instant());
        int newStreak = outcome == IterationOutcome.DONE ? 0 : streak + 1;
        stateStore.append(result, newStreak);
        metrics.recordIteration(outcome.name().toLowerCase(), result.durationMs());

        var payload = new HashMap<String, Object>();
        payload.put("iteration", iteration);
        payload.put("outcome", outcome.name().toLowerCase());
        payload.put("noProgressStreak", newStreak);
        payload.put("gatesPassed", gateResults.stream().allMatch(GateResult::passed));
        payload.put("durationMs", result.durationMs());
        if (task != null) {
            payload.put("title", task.title());
        }
        publish(LoopEvent.ITERATION_FINISHED, task != null ? task.id() : null, payload);
        return result;
    }

    private boolean backlogEmpty() {
        try {
            return tracker.counts().open() == 0;
        } catch (TrackerNetworkException e) {
            log.warn("Could not count tasks after commit: {}", e.getMessage());
            return false;
        }
    }

    static String commitSummary(int iteration, SelectedTask task, List<GateResult> gateResults) {
        var sb = new StringBuilder();
        sb.append("Completed in iteration ").append(iteration).append(": ").append(task.title()).append("\n\n");
        if (gateResults.isEmpty()) {
            sb.append("No gates configured.");
        } else {
            sb.append("Gates passed:\n");
            sb.append(gateResults.stream()
                    .map(g -> "- `%s` (%d ms)".formatted(g.command(), g.durationMs()))
                    .collect(Collectors.joining("\n")));
        }
        return sb.toString();
    }

    private void publish(String type, String taskId, Map<String, Object> payload) {
        eventBus.publish(new LoopEvent(type, runId, taskId, payload, clock.instant()));
    }
}
