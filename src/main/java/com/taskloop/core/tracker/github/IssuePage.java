package com.taskloop.core.tracker.github;

import java.util.List;

/**
 * Result of listing open issues.
 *
 * @param issues      all pages concatenated, pull requests removed; empty when {@code notModified}
 * @param etag        entity tag of the first page, nullable
 * @param notModified the server answered 304 to the conditional request
 */
public record IssuePage(List<IssueSnapshot> issues, String etag, boolean notModified) {

    public IssuePage {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public static IssuePage unchanged(String etag) {
        return new IssuePage(List.of(), etag, true);
    }
}
