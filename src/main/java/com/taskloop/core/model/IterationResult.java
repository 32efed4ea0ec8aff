package com.taskloop.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Record of one iteration. Appended to the run history and never modified afterwards.
 *
 * @param iteration     monotonic iteration number across invocations
 * @param taskId        the selected task, null when nothing was selected
 * @param taskTitle     title of the selected task, null when nothing was selected
 * @param outcome       how the iteration ended
 * @param gateResults   results of every gate that ran
 * @param commentText   completion comment on success, failure explanation otherwise
 * @param agentExitCode exit status of the agent, null when it did not run
 * @param agentTimedOut whether the agent was killed for exceeding its timeout
 * @param startedAt     iteration start
 * @param finishedAt    iteration end
 */
public record IterationResult(
    int iteration,
    String taskId,
    String taskTitle,
    IterationOutcome outcome,
    List<GateResult> gateResults,
    String commentText,
    Integer agentExitCode,
    boolean agentTimedOut,
    Instant startedAt,
    Instant finishedAt
) {

    public IterationResult {
        gateResults = gateResults != null ? List.copyOf(gateResults) : List.of();
    }

    public boolean committed() {
        return outcome == IterationOutcome.DONE;
    }

    public long durationMs() {
        return finishedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
