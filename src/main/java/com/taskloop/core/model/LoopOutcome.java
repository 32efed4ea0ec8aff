package com.taskloop.core.model;

import java.util.List;

/**
 * Result of one loop invocation.
 *
 * @param runId         identifier of the run
 * @param terminalState why the loop stopped
 * @param iterations    iterations executed by this invocation
 */
public record LoopOutcome(String runId, TerminalState terminalState, List<IterationResult> iterations) {

    public static final int EXIT_COMPLETE = 0;
    public static final int EXIT_INCOMPLETE = 1;
    public static final int EXIT_FAILURE = 2;

    public LoopOutcome {
        iterations = List.copyOf(iterations);
    }

    public boolean hadFailures() {
        return iterations.stream().anyMatch(r -> r.outcome() == IterationOutcome.FAILED);
    }

    public long tasksCompleted() {
        return iterations.stream().filter(IterationResult::committed).count();
    }

    /**
     * 2 when any iteration failed, 0 when the backlog is done, 1 otherwise.
     */
    public int exitCode() {
        if (hadFailures()) {
            return EXIT_FAILURE;
        }
        return terminalState == TerminalState.DONE ? EXIT_COMPLETE : EXIT_INCOMPLETE;
    }
}
