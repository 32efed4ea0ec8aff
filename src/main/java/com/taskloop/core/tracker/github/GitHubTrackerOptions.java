package com.taskloop.core.tracker.github;

import com.taskloop.core.tracker.TaskFilter;

import java.time.Duration;
import java.util.List;

/**
 * Behaviour switches of the GitHub Issues tracker.
 *
 * @param repo                    {@code owner/name}
 * @param filter                  eligibility rules; its signature is part of the cache key
 * @param closeOnDone             close the issue on completion
 * @param commentOnDone           post the iteration summary as a comment
 * @param startLabels             labels added when work starts
 * @param doneLabels              labels added on completion
 * @param removeStartLabelsOnDone remove {@code startLabels} on completion
 * @param cacheTtl                age after which the issue list is refreshed
 * @param blockLabel              label added when the loop gives up on an issue, blank for none
 */
public record GitHubTrackerOptions(
    String repo,
    TaskFilter filter,
    boolean closeOnDone,
    boolean commentOnDone,
    List<String> startLabels,
    List<String> doneLabels,
    boolean removeStartLabelsOnDone,
    Duration cacheTtl,
    String blockLabel
) {

    public GitHubTrackerOptions {
        startLabels = startLabels != null ? List.copyOf(startLabels) : List.of();
        doneLabels = doneLabels != null ? List.copyOf(doneLabels) : List.of();
    }

    public String cacheKey() {
        return "github:" + repo + "|" + filter.signature();
    }
}
