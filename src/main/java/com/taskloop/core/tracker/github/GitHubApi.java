package com.taskloop.core.tracker.github;

import com.taskloop.core.ratelimit.RateLimitState;

import java.util.Collection;

/**
 * The GitHub Issues REST operations the tracker needs.
 * <p>
 * Implementations raise {@link com.taskloop.core.tracker.TrackerAuthException} on 401,
 * {@link com.taskloop.core.tracker.TaskNotFoundException} on 404 and
 * {@link com.taskloop.core.tracker.TrackerNetworkException} for transport, server and
 * rate-limit failures that outlast the retry budget.
 */
public interface GitHubApi {

    /**
     * Lists open issues carrying every label in {@code labels}, following pagination.
     *
     * @param etag entity tag from a previous listing, nullable; a match yields {@link IssuePage#unchanged}
     */
    IssuePage listOpenIssues(String repo, Collection<String> labels, String etag);

    IssueSnapshot getIssue(String repo, String number);

    /**
     * @return the id of the created comment
     */
    long createComment(String repo, String number, String body);

    void deleteComment(String repo, long commentId);

    void addLabels(String repo, String number, Collection<String> labels);

    /**
     * Removing a label the issue does not carry is not an error.
     */
    void removeLabel(String repo, String number, String label);

    void setClosed(String repo, String number, boolean closed);

    /**
     * Runs undo steps of a partially applied update. Implementations that rate-limit should
     * let these calls wait for a quota reset rather than give up at the usual patience.
     */
    default void compensate(Runnable action) {
        action.run();
    }

    default RateLimitState rateLimitState() {
        return RateLimitState.UNKNOWN;
    }
}
