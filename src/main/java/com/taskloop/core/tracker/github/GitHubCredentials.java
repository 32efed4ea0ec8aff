package com.taskloop.core.tracker.github;

/**
 * A resolved API token and where it came from. {@link #toString()} never reveals the token.
 *
 * @param token  bearer token
 * @param source human-readable origin, e.g. "credential helper"
 */
public record GitHubCredentials(String token, String source) {

    @Override
    public String toString() {
        return "GitHubCredentials[source=" + source + ", token=****]";
    }
}
