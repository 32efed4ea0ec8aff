package com.taskloop.core.model;

import java.time.Instant;

/**
 * Immutable snapshot of the task chosen for one iteration.
 *
 * @param task       the task as it was when selected
 * @param selectedAt when the tracker handed it out
 */
public record SelectedTask(Task task, Instant selectedAt) {

    public String id() {
        return task.id();
    }

    public String title() {
        return task.title();
    }
}
