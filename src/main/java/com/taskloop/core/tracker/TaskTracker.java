package com.taskloop.core.tracker;

import com.taskloop.core.model.SelectedTask;
import com.taskloop.core.model.TaskCounts;

import java.util.Optional;
import java.util.Set;

/**
 * Contract every tracker backend implements. The concrete backend is chosen by
 * configuration through {@link TrackerFactory}.
 */
public interface TaskTracker {

    /**
     * Backend identifier, e.g. "local" or "github".
     */
    String kind();

    /**
     * Returns the highest-priority eligible task without changing backend state.
     *
     * @param skipIds task ids to pass over even when eligible
     * @return the selected task, or empty when no task qualifies
     * @throws TrackerNetworkException if the backlog cannot be read at all
     */
    Optional<SelectedTask> claimNextTask(Set<String> skipIds);

    default Optional<SelectedTask> claimNextTask() {
        return claimNextTask(Set.of());
    }

    /**
     * @throws TaskNotFoundException if the id is unknown to the backend
     */
    boolean isTaskDone(String taskId);

    /**
     * Reopens a closed task and strips the completion labels this tracker adds.
     * A no-op on a task that is already open.
     *
     * @throws TaskNotFoundException if the id is unknown to the backend
     */
    void forceTaskOpen(String taskId);

    /**
     * Commits completion: comment, completion labels and close as one logical unit.
     *
     * @throws PartialUpdateException if a sub-step failed; observable state has been restored
     * @throws TaskNotFoundException  if the id is unknown to the backend
     */
    void markTaskDone(String taskId, String comment);

    /**
     * Open and total task counts, used to tell an exhausted backlog from a blocked one.
     */
    TaskCounts counts();

    /**
     * Marks the task as in progress before the agent runs. Best effort; most backends
     * have nothing to do here.
     */
    default void markTaskStarted(String taskId) {
    }

    /**
     * Undoes {@link #markTaskStarted} after an iteration that did not commit. Best effort.
     */
    default void markTaskAbandoned(String taskId) {
    }

    /**
     * Flags a task the loop has given up on so it is no longer selected. Best effort.
     *
     * @return whether the backend recorded the block
     */
    default boolean blockTask(String taskId, String reason) {
        return false;
    }

    /**
     * Drops any cached view of the backlog and reads it again from the source.
     */
    default void sync() {
    }

    /**
     * Last recoverable problem, e.g. a failed refresh that fell back to cached data.
     */
    default Optional<String> lastWarning() {
        return Optional.empty();
    }
}
