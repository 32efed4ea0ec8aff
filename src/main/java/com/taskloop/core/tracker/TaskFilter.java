package com.taskloop.core.tracker;

import com.taskloop.core.model.Task;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Label-based eligibility rules shared by all trackers.
 *
 * @param requiredLabels every one of these must be present
 * @param excludedLabels none of these may be present
 * @param excludeDrafts  whether draft tasks are skipped
 */
public record TaskFilter(Set<String> requiredLabels, Set<String> excludedLabels, boolean excludeDrafts) {

    public TaskFilter {
        requiredLabels = Set.copyOf(requiredLabels);
        excludedLabels = Set.copyOf(excludedLabels);
    }

    /**
     * Builds a filter from the configured comma-separated label filter.
     */
    public static TaskFilter of(String labelFilter, Collection<String> excludeLabels, boolean excludeDrafts) {
        var required = new LinkedHashSet<String>();
        if (labelFilter != null) {
            Arrays.stream(labelFilter.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(required::add);
        }
        var excluded = new LinkedHashSet<String>();
        if (excludeLabels != null) {
            excludeLabels.stream()
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(excluded::add);
        }
        return new TaskFilter(required, excluded, excludeDrafts);
    }

    public boolean isEligible(Task task) {
        if (task.closed()) {
            return false;
        }
        if (excludeDrafts && task.draft()) {
            return false;
        }
        if (!task.labels().containsAll(requiredLabels)) {
            return false;
        }
        return excludedLabels.stream().noneMatch(task::hasLabel);
    }

    /**
     * Stable textual form used in cache keys; independent of configuration order.
     */
    public String signature() {
        return "labels=" + String.join(",", new TreeSet<>(requiredLabels))
                + "|exclude=" + String.join(",", new TreeSet<>(excludedLabels))
                + "|drafts=" + (excludeDrafts ? "skip" : "keep");
    }

    public List<String> sortedRequiredLabels() {
        return List.copyOf(new TreeSet<>(requiredLabels));
    }
}
