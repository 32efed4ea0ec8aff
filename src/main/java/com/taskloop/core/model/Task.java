package com.taskloop.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A single unit of trackable work as reported by a tracker backend.
 *
 * @param id          tracker-assigned stable identifier (issue number, task id)
 * @param title       short human-readable title
 * @param description free-text description of the work
 * @param acceptance  ordered acceptance criteria
 * @param notes       trailing free-text notes
 * @param labels      labels attached to the task
 * @param milestone   milestone rank (lower is more urgent), nullable
 * @param draft       whether the task is still a draft
 * @param closed      whether the tracker considers the task complete
 */
public record Task(
    String id,
    String title,
    String description,
    List<String> acceptance,
    String notes,
    Set<String> labels,
    Integer milestone,
    boolean draft,
    boolean closed
) implements Serializable {

    public Task {
        description = description != null ? description : "";
        notes = notes != null ? notes : "";
        acceptance = acceptance != null ? List.copyOf(acceptance) : List.of();
        labels = labels != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(labels))
                : Set.of();
    }

    public boolean hasLabel(String label) {
        return labels.contains(label);
    }
}
