package com.taskloop.core.engine;

import com.taskloop.core.agent.AgentInvoker;
import com.taskloop.core.config.ConfigException;
import com.taskloop.core.config.ModeResolver;
import com.taskloop.core.config.TaskloopProperties;
import com.taskloop.core.events.EventBus;
import com.taskloop.core.gate.GateRunner;
import com.taskloop.core.metrics.LoopMetrics;
import com.taskloop.core.model.EffectiveConfig;
import com.taskloop.core.model.IterationResult;
import com.taskloop.core.model.LoopOutcome;
import com.taskloop.core.model.SelectedTask;
import com.taskloop.core.model.TaskCounts;
import com.taskloop.core.state.RunState;
import com.taskloop.core.state.RunStateStore;
import com.taskloop.core.tracker.TaskTracker;
import com.taskloop.core.tracker.TrackerNetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for running the loop. Resolves the effective configuration for each
 * invocation and builds one {@link IterationController} per run.
 */
@Service
public class LoopEngine {

    private static final Logger log = LoggerFactory.getLogger(LoopEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);
    private static final DateTimeFormatter RUN_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final TaskloopProperties properties;
    private final ModeResolver modeResolver;
    private final EffectiveConfig startupConfig;
    private final TaskTracker tracker;
    private final AgentInvoker agent;
    private final GateRunner gateRunner;
    private final RunStateStore stateStore;
    private final EventBus eventBus;
    private final LoopMetrics metrics;
    private final Clock clock;

    public LoopEngine(TaskloopProperties properties, ModeResolver modeResolver, EffectiveConfig startupConfig,
                      @Lazy TaskTracker tracker, AgentInvoker agent, GateRunner gateRunner, RunStateStore stateStore,
                      EventBus eventBus, LoopMetrics metrics, Clock clock) {
        this.properties = properties;
        this.modeResolver = modeResolver;
        this.startupConfig = startupConfig;
        this.tracker = tracker;
        this.agent = agent;
        this.gateRunner = gateRunner;
        this.stateStore = stateStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Effective configuration for one invocation. Resolution happens before any iteration,
     * so an unknown mode or an invalid cap never starts a run.
     *
     * @throws ConfigException if the mode is unknown or a value is invalid
     */
    public EffectiveConfig resolve(RunRequest request) {
        EffectiveConfig config = startupConfig;
        if (request.mode() != null && !request.mode().isBlank()) {
            config = modeResolver.resolve(request.mode(), properties.toLoopConfig(), properties.modeOverrides());
        }
        if (request.maxIterations() != null) {
            if (request.maxIterations() < 1) {
                throw new ConfigException("maxIterations must be >= 1, got " + request.maxIterations());
            }
            config = config.withMaxIterations(request.maxIterations());
        }
        return config;
    }

    public LoopOutcome run(RunRequest request) {
        return run(request, new RunControl(), generateRunId());
    }

    /**
     * Runs up to the effective iteration cap. The persisted no-progress streak starts at zero.
     */
    public LoopOutcome run(RunRequest request, RunControl control, String runId) {
        EffectiveConfig config = resolve(request);
        stateStore.resetStreak();
        return controller(runId, config, control).run();
    }

    /**
     * Runs a single iteration, continuing the persisted no-progress streak.
     */
    public Optional<IterationResult> step(RunRequest request, RunControl control, String runId) {
        EffectiveConfig config = resolve(request);
        return controller(runId, config, control).runIteration();
    }

    public LoopStatus status() {
        RunState state = stateStore.load();
        IterationResult last = state.history().isEmpty() ? null : state.history().get(state.history().size() - 1);
        TaskCounts counts = null;
        SelectedTask next = null;
        String warning = null;
        try {
            counts = tracker.counts();
            Set<String> skipIds = startupConfig.skipBlockedTasks() ? state.blockedTasks().keySet() : Set.of();
            next = tracker.claimNextTask(skipIds).orElse(null);
        } catch (TrackerNetworkException e) {
            log.warn("Tracker unavailable for status: {}", e.getMessage());
            warning = e.getMessage();
        }
        if (warning == null) {
            warning = tracker.lastWarning().orElse(null);
        }
        return new LoopStatus(tracker.kind(), startupConfig.mode(), counts, next, state.noProgressStreak(), last,
                warning);
    }

    public TaskTracker tracker() {
        return tracker;
    }

    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        return "run-%s-%02d".formatted(RUN_ID_FORMAT.format(clock.instant()), count);
    }

    private IterationController controller(String runId, EffectiveConfig config, RunControl control) {
        return new IterationController(runId, config, tracker, agent, gateRunner, stateStore, eventBus, metrics,
                control, clock, properties.resolveProjectRoot());
    }
}
