package com.taskloop.core.tracker;

import com.taskloop.core.TaskloopException;

/**
 * The tracker has no task with the given id.
 */
public class TaskNotFoundException extends TaskloopException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
