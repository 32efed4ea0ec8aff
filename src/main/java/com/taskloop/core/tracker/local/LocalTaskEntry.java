package com.taskloop.core.tracker.local;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskloop.core.model.Task;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * One task as stored in the local task file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LocalTaskEntry(
    String id,
    String title,
    String description,
    List<String> acceptance,
    String notes,
    List<String> labels,
    Integer milestone,
    Boolean draft,
    @JsonProperty("depends_on") List<String> dependsOn,
    Boolean completed,
    List<String> comments,
    @JsonProperty("blocked_reason") String blockedReason
) {

    public boolean done() {
        return Boolean.TRUE.equals(completed);
    }

    public List<String> labelsOrEmpty() {
        return labels != null ? labels : List.of();
    }

    public List<String> dependsOnOrEmpty() {
        return dependsOn != null ? dependsOn : List.of();
    }

    Task toTask() {
        return new Task(id, title, description, acceptance, notes, new LinkedHashSet<>(labelsOrEmpty()),
                milestone, Boolean.TRUE.equals(draft), done());
    }

    LocalTaskEntry completedWith(List<String> doneLabels, String comment) {
        var newLabels = new ArrayList<>(labelsOrEmpty());
        doneLabels.stream().filter(l -> !newLabels.contains(l)).forEach(newLabels::add);
        var newComments = comments != null ? new ArrayList<>(comments) : new ArrayList<String>();
        if (comment != null && !comment.isBlank()) {
            newComments.add(comment);
        }
        return new LocalTaskEntry(id, title, description, acceptance, notes, newLabels, milestone, draft,
                dependsOn, true, newComments.isEmpty() ? null : newComments, blockedReason);
    }

    LocalTaskEntry reopenedWithout(List<String> doneLabels) {
        var newLabels = new ArrayList<>(labelsOrEmpty());
        newLabels.removeAll(doneLabels);
        return new LocalTaskEntry(id, title, description, acceptance, notes, newLabels, milestone, draft,
                dependsOn, false, comments, blockedReason);
    }

    LocalTaskEntry blockedWith(String blockLabel, String reason) {
        var newLabels = new ArrayList<>(labelsOrEmpty());
        if (blockLabel != null && !blockLabel.isBlank() && !newLabels.contains(blockLabel)) {
            newLabels.add(blockLabel);
        }
        return new LocalTaskEntry(id, title, description, acceptance, notes, newLabels, milestone, draft,
                dependsOn, completed, comments, reason);
    }
}
