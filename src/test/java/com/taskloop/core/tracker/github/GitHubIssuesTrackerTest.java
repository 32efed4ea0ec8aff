package com.taskloop.core.tracker.github;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskloop.core.cache.CacheStore;
import com.taskloop.core.metrics.LoopMetrics;
import com.taskloop.core.tracker.PartialUpdateException;
import com.taskloop.core.tracker.TaskFilter;
import com.taskloop.core.tracker.TrackerNetworkException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GitHubIssuesTrackerTest {

    private static final String REPO = "acme/widgets";

    @TempDir
    Path dir;

    private FakeGitHubApi api;
    private MutableClock clock;
    private CacheStore<IssueSnapshot> cache;

    @BeforeEach
    void setUp() {
        api = new FakeGitHubApi();
        api.add(new IssueSnapshot(1, "Set up CI", "", List.of("ready"), null, false));
        api.add(new IssueSnapshot(2, "Add login", """
                ## Acceptance Criteria
                - [ ] Form renders
                """, List.of("ready", "priority:high"), null, false));
        api.add(new IssueSnapshot(3, "Blocked work", "", List.of("ready", "blocked", "priority:critical"), null,
                false));
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        cache = new CacheStore<>(dir, "issues", IssueSnapshot.class, new ObjectMapper().findAndRegisterModules());
    }

    private GitHubIssuesTracker tracker(boolean closeOnDone, List<String> startLabels) {
        var options = new GitHubTrackerOptions(REPO, TaskFilter.of("ready", List.of("blocked"), true),
                closeOnDone, true, startLabels, List.of("completed"), true, Duration.ofSeconds(300), "blocked");
        return new GitHubIssuesTracker(api, cache, options, clock, new LoopMetrics(new SimpleMeterRegistry()));
    }

    private GitHubIssuesTracker tracker() {
        return tracker(true, List.of());
    }

    @Nested
    @DisplayName("selection and caching")
    class Selection {

        @Test
        @DisplayName("selects by priority and skips excluded labels")
        void selectsHighestPriorityEligible() {
            var selected = tracker().claimNextTask().orElseThrow();

            assertEquals("2", selected.id());
            assertEquals(List.of("Form renders"), selected.task().acceptance());
        }

        @Test
        @DisplayName("two selections within the TTL issue one fetch")
        void oneFetchWithinTtl() {
            var tracker = tracker();
            tracker.claimNextTask();
            clock.advance(Duration.ofSeconds(120));
            tracker.claimNextTask();

            assertEquals(1, api.listCalls());
        }

        @Test
        @DisplayName("a selection after TTL expiry issues exactly one conditional refresh")
        void refreshAfterTtl() {
            var tracker = tracker();
            tracker.claimNextTask();
            clock.advance(Duration.ofSeconds(301));
            tracker.claimNextTask();
            tracker.claimNextTask();

            assertEquals(2, api.listCalls());
        }

        @Test
        @DisplayName("the cache survives a new tracker instance")
        void cacheSurvivesRestart() {
            tracker().claimNextTask();
            clock.advance(Duration.ofSeconds(10));

            tracker().claimNextTask();

            assertEquals(1, api.listCalls());
        }

        @Test
        @DisplayName("a failed refresh falls back to the stale list and records a warning")
        void staleFallback() {
            var tracker = tracker();
            tracker.claimNextTask();
            clock.advance(Duration.ofHours(1));
            api.offline = true;

            var selected = tracker.claimNextTask();

            assertEquals("2", selected.orElseThrow().id());
            assertTrue(tracker.lastWarning().isPresent());
        }

        @Test
        @DisplayName("without any cache a network failure propagates")
        void noCacheNoFallback() {
            api.offline = true;

            assertThrows(TrackerNetworkException.class, () -> tracker().claimNextTask());
        }

        @Test
        @DisplayName("sync refreshes regardless of age and clears the warning")
        void syncForcesRefresh() {
            var tracker = tracker();
            tracker.claimNextTask();
            tracker.sync();

            assertEquals(2, api.listCalls());
            assertTrue(tracker.lastWarning().isEmpty());
        }
    }

    @Nested
    @DisplayName("completion")
    class Completion {

        @Test
        @DisplayName("markTaskDone comments, labels and closes in order")
        void orderedSteps() {
            var tracker = tracker(true, List.of("in-progress"));
            api.add(api.issues.get("2").withLabels(List.of("ready", "priority:high", "in-progress")));

            tracker.markTaskDone("2", "All gates passed");

            assertEquals(List.of("get", "comment", "add_labels", "close", "remove_label"), api.calls);
            var issue = api.issues.get("2");
            assertTrue(issue.closed());
            assertTrue(issue.labels().contains("completed"));
            assertFalse(issue.labels().contains("in-progress"));
            assertEquals(List.of("All gates passed"), List.copyOf(api.comments.values()));
        }

        @Test
        @DisplayName("a closed task is never reselected, even from the cache")
        void closedTaskLeavesCache() {
            var tracker = tracker();
            tracker.claimNextTask();
            tracker.markTaskDone("2", "done");
            api.offline = true;

            assertEquals("1", tracker.claimNextTask().orElseThrow().id());
        }

        @Test
        @DisplayName("a failed label step rolls back the comment and leaves the issue open")
        void partialFailureRollsBack() {
            var tracker = tracker();
            api.failOn = "add_labels";

            var e = assertThrows(PartialUpdateException.class, () -> tracker.markTaskDone("2", "summary"));

            assertEquals("add_labels", e.getFailedStep());
            assertTrue(e.isRolledBack());
            var issue = api.issues.get("2");
            assertFalse(issue.closed());
            assertFalse(issue.labels().contains("completed"));
            assertTrue(api.comments.isEmpty());
        }

        @Test
        @DisplayName("a failed close removes the added done labels again")
        void closeFailureRemovesLabels() {
            var tracker = tracker();
            api.failOn = "close";

            assertThrows(PartialUpdateException.class, () -> tracker.markTaskDone("2", "summary"));

            var issue = api.issues.get("2");
            assertFalse(issue.closed());
            assertEquals(List.of("ready", "priority:high"), issue.labels());
            assertTrue(api.comments.isEmpty());
        }

        @Test
        @DisplayName("an already closed issue is a no-op")
        void alreadyClosed() {
            api.add(api.issues.get("1").withClosed(true));

            tracker().markTaskDone("1", "again");

            assertEquals(List.of("get"), api.calls);
        }

        @Test
        @DisplayName("without closing, done labels mark the issue done")
        void doneByLabel() {
            var tracker = tracker(false, List.of());

            tracker.markTaskDone("2", "summary");

            assertFalse(api.issues.get("2").closed());
            assertTrue(tracker.isTaskDone("2"));
            assertEquals("1", tracker.claimNextTask().orElseThrow().id());
        }

        @Test
        @DisplayName("forceTaskOpen reopens and strips only done labels")
        void forceOpen() {
            var tracker = tracker();
            tracker.markTaskDone("2", "summary");

            tracker.forceTaskOpen("2");

            var issue = api.issues.get("2");
            assertFalse(issue.closed());
            assertEquals(List.of("ready", "priority:high"), issue.labels());
            assertFalse(tracker.isTaskDone("2"));
        }
    }

    @Nested
    @DisplayName("blocking and abandoning")
    class Blocking {

        @Test
        @DisplayName("skipped ids are passed over during selection")
        void skipIds() {
            assertEquals("1", tracker().claimNextTask(Set.of("2")).orElseThrow().id());
        }

        @Test
        @DisplayName("blockTask labels the issue and the cached copy stops being eligible")
        void blockLabelsIssue() {
            var tracker = tracker();
            tracker.claimNextTask();

            assertTrue(tracker.blockTask("2", "Blocked after 3 failed attempt(s)"));

            assertTrue(api.issues.get("2").labels().contains("blocked"));
            assertEquals("1", tracker.claimNextTask().orElseThrow().id());
            assertEquals(1, api.listCalls());
        }

        @Test
        @DisplayName("a failed block is reported, not thrown")
        void blockFailure() {
            api.failOn = "add_labels";

            assertFalse(tracker().blockTask("2", "reason"));
        }

        @Test
        @DisplayName("markTaskAbandoned removes the start labels again")
        void abandonRemovesStartLabels() {
            var tracker = tracker(true, List.of("in-progress"));
            tracker.markTaskStarted("2");
            assertTrue(api.issues.get("2").labels().contains("in-progress"));

            tracker.markTaskAbandoned("2");

            assertEquals(List.of("ready", "priority:high"), api.issues.get("2").labels());
        }

        @Test
        @DisplayName("a failure while removing start labels is only logged")
        void abandonFailureSwallowed() {
            var tracker = tracker(true, List.of("in-progress"));
            api.failOn = "remove_label";

            assertDoesNotThrow(() -> tracker.markTaskAbandoned("2"));
        }
    }

    @Test
    @DisplayName("counts excludes nothing but done issues")
    void counts() {
        var counts = tracker().counts();

        assertEquals(3, counts.open());
    }

    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
