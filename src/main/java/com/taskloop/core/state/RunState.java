package com.taskloop.core.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.taskloop.core.model.IterationOutcome;
import com.taskloop.core.model.IterationResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable loop state kept in {@code <state-dir>/state.json}.
 *
 * @param createdAt        when the state file was first written
 * @param noProgressStreak iterations in a row without a successful commit
 * @param history          iteration results, oldest first
 * @param taskAttempts     failed iterations per task id since its last success
 * @param blockedTasks     tasks that reached the attempt limit, by id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunState(Instant createdAt, int noProgressStreak, List<IterationResult> history,
                       Map<String, Integer> taskAttempts, Map<String, BlockedTask> blockedTasks) {

    public RunState {
        history = history != null ? List.copyOf(history) : List.of();
        taskAttempts = taskAttempts != null ? Map.copyOf(taskAttempts) : Map.of();
        blockedTasks = blockedTasks != null ? Map.copyOf(blockedTasks) : Map.of();
    }

    public static RunState fresh(Instant now) {
        return new RunState(now, 0, List.of(), Map.of(), Map.of());
    }

    /**
     * Highest iteration number recorded so far, 0 when there is none.
     */
    public int lastIteration() {
        return history.stream().mapToInt(IterationResult::iteration).max().orElse(0);
    }

    public int attemptsFor(String taskId) {
        return taskAttempts.getOrDefault(taskId, 0);
    }

    /**
     * Start times of recorded iterations in which the agent actually ran, at or after {@code since}.
     */
    public List<Instant> agentInvocationsSince(Instant since) {
        return history.stream()
                .filter(r -> r.agentExitCode() != null || r.agentTimedOut())
                .map(IterationResult::startedAt)
                .filter(t -> t != null && !t.isBefore(since))
                .sorted()
                .toList();
    }

    public RunState withStreak(int streak) {
        return new RunState(createdAt, streak, history, taskAttempts, blockedTasks);
    }

    RunState withCreatedAt(Instant created) {
        return new RunState(created, noProgressStreak, history, taskAttempts, blockedTasks);
    }

    RunState withBlocked(String taskId, BlockedTask blocked) {
        var merged = new LinkedHashMap<>(blockedTasks);
        merged.put(taskId, blocked);
        return new RunState(createdAt, noProgressStreak, history, taskAttempts, merged);
    }

    /**
     * Adds {@code result} to the history. A failed iteration counts one attempt against its
     * task; a committed one clears the count.
     */
    RunState appending(IterationResult result, int streak, int maxHistory) {
        var merged = new ArrayList<>(history);
        merged.add(result);
        if (merged.size() > maxHistory) {
            merged = new ArrayList<>(merged.subList(merged.size() - maxHistory, merged.size()));
        }
        var attempts = new LinkedHashMap<>(taskAttempts);
        if (result.taskId() != null) {
            if (result.outcome() == IterationOutcome.FAILED) {
                attempts.merge(result.taskId(), 1, Integer::sum);
            } else if (result.outcome() == IterationOutcome.DONE) {
                attempts.remove(result.taskId());
            }
        }
        return new RunState(createdAt, streak, merged, attempts, blockedTasks);
    }
}
