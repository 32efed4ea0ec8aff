package com.taskloop.core.tracker.github;

import com.taskloop.core.TaskloopException;
import com.taskloop.core.cache.CacheEntry;
import com.taskloop.core.cache.CacheStore;
import com.taskloop.core.metrics.LoopMetrics;
import com.taskloop.core.model.SelectedTask;
import com.taskloop.core.model.TaskCounts;
import com.taskloop.core.ratelimit.RateLimitState;
import com.taskloop.core.tracker.PartialUpdateException;
import com.taskloop.core.tracker.TaskPriority;
import com.taskloop.core.tracker.TaskTracker;
import com.taskloop.core.tracker.TrackerNetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Tracker backed by GitHub Issues.
 * <p>
 * Selection reads the cached issue list for (repo, filter) and refreshes it only once the
 * TTL has expired. A failed refresh falls back to the stale list and records a warning, so
 * the loop keeps working offline. Completion applies comment, done labels, close and start
 * label removal in that order and undoes the applied steps in reverse if any of them fails.
 */
public class GitHubIssuesTracker implements TaskTracker {

    private static final Logger log = LoggerFactory.getLogger(GitHubIssuesTracker.class);

    private final GitHubApi api;
    private final CacheStore<IssueSnapshot> cache;
    private final GitHubTrackerOptions options;
    private final Clock clock;
    private final LoopMetrics metrics;

    private volatile String lastWarning;

    public GitHubIssuesTracker(GitHubApi api, CacheStore<IssueSnapshot> cache, GitHubTrackerOptions options,
                               Clock clock, LoopMetrics metrics) {
        this.api = api;
        this.cache = cache;
        this.options = options;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public String kind() {
        return "github";
    }

    @Override
    public synchronized Optional<SelectedTask> claimNextTask(Set<String> skipIds) {
        return openIssues().stream()
                .filter(issue -> !isDone(issue))
                .filter(issue -> !skipIds.contains(issue.id()))
                .map(IssueSnapshot::toTask)
                .filter(options.filter()::isEligible)
                .min(TaskPriority.ORDER)
                .map(task -> {
                    log.debug("Selected issue #{} ({})", task.id(), task.title());
                    return new SelectedTask(task, clock.instant());
                });
    }

    @Override
    public synchronized TaskCounts counts() {
        int open = (int) openIssues().stream().filter(issue -> !isDone(issue)).count();
        // closed issues are never listed, so the open set is all we know about
        return new TaskCounts(open, open);
    }

    @Override
    public synchronized boolean isTaskDone(String taskId) {
        IssueSnapshot issue;
        try {
            issue = api.getIssue(options.repo(), taskId);
        } catch (TrackerNetworkException e) {
            var cached = cachedIssue(taskId);
            if (cached.isEmpty()) {
                throw e;
            }
            warn("Could not read issue #%s (%s); using cached state".formatted(taskId, e.getMessage()));
            return isDone(cached.get());
        }
        return isDone(issue);
    }

    @Override
    public synchronized void forceTaskOpen(String taskId) {
        String repo = options.repo();
        IssueSnapshot issue = api.getIssue(repo, taskId);
        var presentDoneLabels = options.doneLabels().stream().filter(issue.labels()::contains).toList();
        if (!issue.closed() && presentDoneLabels.isEmpty()) {
            log.debug("Issue #{} already open", taskId);
            return;
        }
        if (issue.closed()) {
            api.setClosed(repo, taskId, false);
        }
        for (String label : presentDoneLabels) {
            api.removeLabel(repo, taskId, label);
        }
        var remaining = new ArrayList<>(issue.labels());
        remaining.removeAll(presentDoneLabels);
        IssueSnapshot reopened = issue.withClosed(false).withLabels(remaining);
        if (reopened.labels().containsAll(options.filter().requiredLabels())) {
            editCache(payload -> replaceIssue(payload, reopened));
        }
        log.info("Reopened issue #{} (removed labels {})", taskId, presentDoneLabels);
    }

    @Override
    public synchronized void markTaskDone(String taskId, String comment) {
        String repo = options.repo();
        IssueSnapshot issue = api.getIssue(repo, taskId);
        if (issue.closed()) {
            log.info("Issue #{} already closed; nothing to commit", taskId);
            editCache(payload -> removeIssue(payload, taskId));
            return;
        }

        var newDoneLabels = options.doneLabels().stream().filter(l -> !issue.labels().contains(l)).toList();
        var startLabelsToRemove = options.removeStartLabelsOnDone()
                ? options.startLabels().stream().filter(issue.labels()::contains).toList()
                : List.<String>of();

        Long commentId = null;
        boolean labelsAttempted = false;
        boolean closeAttempted = false;
        var removedStartLabels = new ArrayList<String>();
        String step = "comment";
        try {
            if (options.commentOnDone() && comment != null && !comment.isBlank()) {
                commentId = api.createComment(repo, taskId, comment);
            }
            step = "add_labels";
            if (!newDoneLabels.isEmpty()) {
                labelsAttempted = true;
                api.addLabels(repo, taskId, newDoneLabels);
            }
            step = "close";
            if (options.closeOnDone()) {
                closeAttempted = true;
                api.setClosed(repo, taskId, true);
            }
            step = "remove_start_labels";
            for (String label : startLabelsToRemove) {
                api.removeLabel(repo, taskId, label);
                removedStartLabels.add(label);
            }
        } catch (TaskloopException e) {
            log.warn("Completion of issue #{} failed at step '{}': {}", taskId, step, e.getMessage());
            boolean restored = rollback(taskId, commentId, labelsAttempted ? newDoneLabels : List.of(),
                    closeAttempted, removedStartLabels);
            throw new PartialUpdateException(taskId, step, restored, e);
        }

        if (options.closeOnDone()) {
            editCache(payload -> removeIssue(payload, taskId));
        } else {
            var labels = new ArrayList<>(issue.labels());
            labels.removeAll(removedStartLabels);
            labels.addAll(newDoneLabels);
            editCache(payload -> replaceIssue(payload, issue.withLabels(labels)));
        }
        log.info("Marked issue #{} done", taskId);
    }

    @Override
    public void markTaskStarted(String taskId) {
        if (options.startLabels().isEmpty()) {
            return;
        }
        try {
            api.addLabels(options.repo(), taskId, options.startLabels());
        } catch (TaskloopException e) {
            log.warn("Could not add start labels to issue #{}: {}", taskId, e.getMessage());
        }
    }

    /**
     * Removes the start labels again. A start label the issue carried before the
     * iteration is removed too.
     */
    @Override
    public void markTaskAbandoned(String taskId) {
        for (String label : options.startLabels()) {
            try {
                api.removeLabel(options.repo(), taskId, label);
            } catch (TaskloopException e) {
                log.warn("Could not remove start label '{}' from issue #{}: {}", label, taskId, e.getMessage());
            }
        }
    }

    @Override
    public synchronized boolean blockTask(String taskId, String reason) {
        String label = options.blockLabel();
        if (label == null || label.isBlank()) {
            return false;
        }
        try {
            api.addLabels(options.repo(), taskId, List.of(label));
        } catch (TaskloopException e) {
            log.error("Could not block issue #{}: {}", taskId, e.getMessage());
            return false;
        }
        cachedIssue(taskId).ifPresent(issue -> {
            var labels = new ArrayList<>(issue.labels());
            if (!labels.contains(label)) {
                labels.add(label);
            }
            IssueSnapshot blocked = issue.withLabels(labels);
            editCache(payload -> replaceIssue(payload, blocked));
        });
        log.info("Labelled issue #{} '{}': {}", taskId, label, reason);
        return true;
    }

    /**
     * Forces a refresh of the cached issue list, ignoring TTL and entity tag.
     */
    @Override
    public synchronized void sync() {
        var entry = refresh(null);
        log.info("Synced {} open issue(s) from {}", entry.payload().size(), options.repo());
    }

    @Override
    public Optional<String> lastWarning() {
        return Optional.ofNullable(lastWarning);
    }

    private List<IssueSnapshot> openIssues() {
        Optional<CacheEntry<IssueSnapshot>> cached = cache.read(options.cacheKey());
        Instant now = clock.instant();
        if (cached.isPresent() && !cached.get().isExpired(now)) {
            metrics.recordCacheLookup("hit");
            return cached.get().payload();
        }
        try {
            return refresh(cached.orElse(null)).payload();
        } catch (TrackerNetworkException e) {
            if (cached.isEmpty()) {
                metrics.recordCacheLookup("miss");
                throw e;
            }
            metrics.recordCacheLookup("stale");
            warn("Refreshing issues of %s failed (%s); using cached list from %s"
                    .formatted(options.repo(), e.getMessage(), cached.get().fetchedAt()));
            return cached.get().payload();
        }
    }

    private CacheEntry<IssueSnapshot> refresh(CacheEntry<IssueSnapshot> previous) {
        String etag = previous != null ? previous.etag() : null;
        IssuePage page = api.listOpenIssues(options.repo(), options.filter().sortedRequiredLabels(), etag);
        RateLimitState quota = api.rateLimitState();
        Instant now = clock.instant();

        CacheEntry<IssueSnapshot> entry;
        if (page.notModified() && previous != null) {
            metrics.recordCacheLookup("renewed");
            entry = previous.renewed(now, quota.remaining(), quota.resetAt());
        } else {
            metrics.recordCacheLookup("miss");
            entry = new CacheEntry<>(options.cacheKey(), page.issues(), now, options.cacheTtl().toSeconds(),
                    page.etag(), quota.remaining(), quota.resetAt());
        }
        store(entry);
        lastWarning = null;
        return entry;
    }

    private boolean rollback(String taskId, Long commentId, List<String> addedDoneLabels, boolean closeAttempted,
                             List<String> removedStartLabels) {
        String repo = options.repo();
        boolean restored = true;
        if (!removedStartLabels.isEmpty()) {
            restored &= undo("re-add start labels", () -> api.addLabels(repo, taskId, removedStartLabels));
        }
        if (closeAttempted) {
            restored &= undo("reopen", () -> api.setClosed(repo, taskId, false));
        }
        for (String label : addedDoneLabels) {
            restored &= undo("remove label " + label, () -> api.removeLabel(repo, taskId, label));
        }
        if (commentId != null) {
            restored &= undo("delete comment", () -> api.deleteComment(repo, commentId));
        }
        return restored;
    }

    private boolean undo(String what, Runnable action) {
        try {
            api.compensate(action);
            return true;
        } catch (TaskloopException e) {
            log.error("Rollback step '{}' failed: {}", what, e.getMessage());
            return false;
        }
    }

    private boolean isDone(IssueSnapshot issue) {
        if (issue.closed()) {
            return true;
        }
        return !options.closeOnDone() && issue.labels().stream().anyMatch(options.doneLabels()::contains);
    }

    private Optional<IssueSnapshot> cachedIssue(String taskId) {
        return cache.read(options.cacheKey())
                .flatMap(entry -> entry.payload().stream().filter(i -> i.id().equals(taskId)).findFirst());
    }

    private void editCache(UnaryOperator<List<IssueSnapshot>> edit) {
        cache.read(options.cacheKey()).ifPresent(entry -> store(entry.withPayload(edit)));
    }

    private void store(CacheEntry<IssueSnapshot> entry) {
        try {
            cache.write(entry);
        } catch (IOException e) {
            log.warn("Could not persist issue cache {}: {}", entry.key(), e.getMessage());
        }
    }

    private void warn(String message) {
        lastWarning = message;
        log.warn(message);
    }

    private static List<IssueSnapshot> removeIssue(List<IssueSnapshot> payload, String taskId) {
        return payload.stream().filter(i -> !i.id().equals(taskId)).toList();
    }

    private static List<IssueSnapshot> replaceIssue(List<IssueSnapshot> payload, IssueSnapshot updated) {
        var result = new ArrayList<>(removeIssue(payload, updated.id()));
        result.add(updated);
        return result;
    }
}
