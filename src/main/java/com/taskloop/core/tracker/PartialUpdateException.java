package com.taskloop.core.tracker;

import com.taskloop.core.TaskloopException;

/**
 * A completion commit could not apply all of its steps. By the time this is thrown the
 * backend has undone the steps that did succeed, unless {@link #isRolledBack()} says otherwise.
 */
public class PartialUpdateException extends TaskloopException {

    private final String taskId;
    private final String failedStep;
    private final boolean rolledBack;

    public PartialUpdateException(String taskId, String failedStep, boolean rolledBack, Throwable cause) {
        super("Completion of task %s failed at step '%s'%s".formatted(taskId, failedStep,
                rolledBack ? "; prior state restored" : "; rollback incomplete, manual cleanup required"), cause);
        this.taskId = taskId;
        this.failedStep = failedStep;
        this.rolledBack = rolledBack;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getFailedStep() {
        return failedStep;
    }

    public boolean isRolledBack() {
        return rolledBack;
    }
}
