package com.taskloop.core.engine;

import com.taskloop.core.model.IterationResult;
import com.taskloop.core.model.SelectedTask;
import com.taskloop.core.model.TaskCounts;

/**
 * Snapshot for the status command and the bridge.
 *
 * @param trackerKind      active backend
 * @param mode             configured mode
 * @param counts           open/total, null when the tracker could not be read
 * @param next             task that would be selected next, null when none or unreadable
 * @param noProgressStreak persisted streak
 * @param lastResult       most recent iteration, null before the first one
 * @param warning          tracker read problem, null when none
 */
public record LoopStatus(
    String trackerKind,
    String mode,
    TaskCounts counts,
    SelectedTask next,
    int noProgressStreak,
    IterationResult lastResult,
    String warning
) {
}
