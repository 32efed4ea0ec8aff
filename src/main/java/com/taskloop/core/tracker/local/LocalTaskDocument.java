package com.taskloop.core.tracker.local;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Root of the local task file: {@code {"version": 1, "tasks": [...]}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LocalTaskDocument(Integer version, List<LocalTaskEntry> tasks) {

    public static final int CURRENT_VERSION = 1;

    LocalTaskDocument replacing(LocalTaskEntry updated) {
        var newTasks = tasks.stream()
                .map(t -> t.id().equals(updated.id()) ? updated : t)
                .toList();
        return new LocalTaskDocument(version, newTasks);
    }
}
