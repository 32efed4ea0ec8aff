package com.taskloop.core.model;

import java.util.List;

/**
 * Base loop configuration before any mode overrides are applied.
 *
 * @param maxIterations                 iterations allowed per invocation
 * @param noProgressLimit               consecutive iterations without a commit before aborting
 * @param gates                         ordered gate commands
 * @param runnerTimeoutSeconds          agent invocation timeout
 * @param mode                          configured mode name
 * @param sleepSecondsBetweenIterations pause between iterations
 * @param maxAttemptsPerTask            failed iterations on one task before it is blocked, 0 for no limit
 * @param skipBlockedTasks              leave tasks blocked by this loop out of selection
 * @param rateLimitPerHour              agent invocations allowed in any rolling hour, 0 for no limit
 */
public record LoopConfig(
    int maxIterations,
    int noProgressLimit,
    List<GateCommand> gates,
    int runnerTimeoutSeconds,
    String mode,
    int sleepSecondsBetweenIterations,
    int maxAttemptsPerTask,
    boolean skipBlockedTasks,
    int rateLimitPerHour
) {

    public LoopConfig {
        gates = gates != null ? List.copyOf(gates) : List.of();
    }
}
