package com.taskloop.core.model;

import java.util.List;

/**
 * Loop settings in force for one run: the base configuration with the selected mode
 * folded in. Immutable once created.
 */
public record EffectiveConfig(
    String mode,
    int maxIterations,
    int noProgressLimit,
    List<GateCommand> gates,
    int runnerTimeoutSeconds,
    int sleepSecondsBetweenIterations,
    int maxAttemptsPerTask,
    boolean skipBlockedTasks,
    int rateLimitPerHour
) {

    public EffectiveConfig {
        gates = List.copyOf(gates);
    }

    public static EffectiveConfig of(LoopConfig base) {
        return new EffectiveConfig(base.mode(), base.maxIterations(), base.noProgressLimit(),
                base.gates(), base.runnerTimeoutSeconds(), base.sleepSecondsBetweenIterations(),
                base.maxAttemptsPerTask(), base.skipBlockedTasks(), base.rateLimitPerHour());
    }

    public EffectiveConfig withMaxIterations(int maxIterations) {
        return new EffectiveConfig(mode, maxIterations, noProgressLimit, gates,
                runnerTimeoutSeconds, sleepSecondsBetweenIterations, maxAttemptsPerTask, skipBlockedTasks,
                rateLimitPerHour);
    }
}
