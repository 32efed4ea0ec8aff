package com.taskloop.core.model;

import java.util.List;

/**
 * Sparse set of loop settings contributed by a named mode. A {@code null} field inherits
 * the base value.
 */
public record ModeOverride(
    Integer maxIterations,
    Integer noProgressLimit,
    List<GateCommand> gates,
    Integer runnerTimeoutSeconds,
    Integer sleepSecondsBetweenIterations,
    Integer maxAttemptsPerTask,
    Boolean skipBlockedTasks,
    Integer rateLimitPerHour
) {

    public static final ModeOverride EMPTY = new ModeOverride(null, null, null, null, null, null, null, null);

    public ModeOverride {
        gates = gates != null ? List.copyOf(gates) : null;
    }

    public static ModeOverride ofMaxIterations(int maxIterations) {
        return new ModeOverride(maxIterations, null, null, null, null, null, null, null);
    }

    public boolean isEmpty() {
        return this.equals(EMPTY);
    }
}
