package com.taskloop.core.tracker.github;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.taskloop.core.model.Task;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * The fields of a GitHub issue that selection needs, as cached on disk.
 *
 * @param number    issue number
 * @param title     issue title
 * @param body      raw markdown body, may be empty
 * @param labels    label names
 * @param milestone milestone number, nullable
 * @param closed    whether the issue state is "closed"
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IssueSnapshot(long number, String title, String body, List<String> labels, Integer milestone,
                            boolean closed) {

    public static final String DRAFT_LABEL = "draft";
    private static final List<String> DRAFT_TITLE_PREFIXES = List.of("[draft]", "draft:", "[wip]");

    public IssueSnapshot {
        title = title != null ? title : "Issue " + number;
        body = body != null ? body : "";
        labels = labels != null ? List.copyOf(labels) : List.of();
    }

    public String id() {
        return Long.toString(number);
    }

    @JsonIgnore
    public boolean isDraft() {
        if (labels.stream().anyMatch(l -> l.equalsIgnoreCase(DRAFT_LABEL))) {
            return true;
        }
        String lower = title.strip().toLowerCase(Locale.ROOT);
        return DRAFT_TITLE_PREFIXES.stream().anyMatch(lower::startsWith);
    }

    public IssueSnapshot withLabels(List<String> newLabels) {
        return new IssueSnapshot(number, title, body, newLabels, milestone, closed);
    }

    public IssueSnapshot withClosed(boolean newClosed) {
        return new IssueSnapshot(number, title, body, labels, milestone, newClosed);
    }

    public Task toTask() {
        var parsed = IssueBodyParser.parse(body);
        return new Task(id(), title, parsed.description(), parsed.acceptance(), parsed.notes(),
                new LinkedHashSet<>(labels), milestone, isDraft(), closed);
    }
}
