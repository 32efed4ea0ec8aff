package com.taskloop.core.tracker.local;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskloop.core.config.ConfigException;
import com.taskloop.core.model.SelectedTask;
import com.taskloop.core.tracker.TaskFilter;
import com.taskloop.core.tracker.TaskNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LocalFileTrackerTest {

    private static final String TASKS = """
            {
              "version": 1,
              "tasks": [
                {"id": "1", "title": "Set up build", "labels": ["ready"], "completed": true},
                {"id": "2", "title": "Add login", "labels": ["ready"],
                 "acceptance": ["Login form renders", "Bad password is rejected"]},
                {"id": "3", "title": "Add logout", "labels": ["ready", "priority:high"], "depends_on": ["2"]},
                {"id": "4", "title": "Spike", "labels": ["ready", "blocked", "priority:critical"]},
                {"id": "5", "title": "Unlabelled"}
              ]
            }
            """;

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    private Path file;

    @BeforeEach
    void setUp() throws Exception {
        file = dir.resolve("tasks.json");
        Files.writeString(file, TASKS);
    }

    private LocalFileTracker tracker(String labelFilter) {
        return new LocalFileTracker(file, TaskFilter.of(labelFilter, List.of("blocked"), true),
                List.of("completed"), "blocked", mapper, clock);
    }

    @Nested
    @DisplayName("selection")
    class Selection {

        @Test
        @DisplayName("skips closed, excluded, unlabelled and dependency-blocked tasks")
        void selectsEligibleTask() {
            SelectedTask selected = tracker("ready").claimNextTask().orElseThrow();

            assertEquals("2", selected.id());
            assertEquals(List.of("Login form renders", "Bad password is rejected"), selected.task().acceptance());
            assertEquals(clock.instant(), selected.selectedAt());
        }

        @Test
        @DisplayName("a task becomes eligible once its dependency is done")
        void dependencyUnlocks() {
            var tracker = tracker("ready");
            tracker.markTaskDone("2", "done");

            assertEquals("3", tracker.claimNextTask().orElseThrow().id());
        }

        @Test
        @DisplayName("skipped ids are never selected")
        void skipIds() {
            assertTrue(tracker("ready").claimNextTask(Set.of("2")).isEmpty());
        }

        @Test
        @DisplayName("returns empty when nothing is eligible")
        void nothingEligible() {
            assertTrue(tracker("nonexistent-label").claimNextTask().isEmpty());
        }

        @Test
        @DisplayName("edits made to the file between calls are picked up")
        void rereadsFile() throws Exception {
            var tracker = tracker("ready");
            Files.writeString(file, TASKS.replace("\"id\": \"2\", \"title\": \"Add login\", \"labels\": [\"ready\"]",
                    "\"id\": \"2\", \"title\": \"Add login\", \"labels\": [\"ready\"], \"completed\": true"));

            assertEquals("3", tracker.claimNextTask().orElseThrow().id());
        }
    }

    @Nested
    @DisplayName("mutations")
    class Mutations {

        @Test
        @DisplayName("markTaskDone persists completion, done labels and the comment")
        void markDonePersists() throws Exception {
            tracker("ready").markTaskDone("2", "All gates passed");

            JsonNode task = mapper.readTree(file.toFile()).get("tasks").get(1);
            assertTrue(task.get("completed").asBoolean());
            assertEquals("completed", task.get("labels").get(1).asText());
            assertEquals("All gates passed", task.get("comments").get(0).asText());
            assertTrue(tracker("ready").isTaskDone("2"));
        }

        @Test
        @DisplayName("markTaskDone on a completed task is a no-op")
        void markDoneIdempotent() throws Exception {
            String before = Files.readString(file);

            tracker("ready").markTaskDone("1", "again");

            assertEquals(before, Files.readString(file));
        }

        @Test
        @DisplayName("forceTaskOpen reopens and strips done labels")
        void forceOpen() throws Exception {
            var tracker = tracker("ready");
            tracker.markTaskDone("2", "done");

            tracker.forceTaskOpen("2");

            assertFalse(tracker.isTaskDone("2"));
            JsonNode labels = mapper.readTree(file.toFile()).get("tasks").get(1).get("labels");
            assertEquals(1, labels.size());
            assertEquals("ready", labels.get(0).asText());
        }

        @Test
        @DisplayName("blockTask adds the block label and records the reason")
        void blockPersists() throws Exception {
            var tracker = tracker("ready");

            assertTrue(tracker.blockTask("2", "Blocked after 3 failed attempt(s)"));

            String json = Files.readString(file);
            assertTrue(json.contains("blocked_reason"));
            assertTrue(json.contains("Blocked after 3 failed attempt(s)"));
            assertTrue(tracker.claimNextTask().isEmpty());
            assertFalse(tracker.blockTask("2", "Blocked after 3 failed attempt(s)"));
        }

        @Test
        @DisplayName("unknown task ids raise TaskNotFoundException")
        void unknownId() {
            var tracker = tracker("ready");

            assertThrows(TaskNotFoundException.class, () -> tracker.isTaskDone("99"));
            assertThrows(TaskNotFoundException.class, () -> tracker.markTaskDone("99", "x"));
        }
    }

    @Test
    @DisplayName("counts reports open and total tasks")
    void counts() {
        var counts = tracker("ready").counts();

        assertEquals(4, counts.open());
        assertEquals(5, counts.total());
    }

    @Nested
    @DisplayName("invalid files")
    class InvalidFiles {

        @Test
        @DisplayName("a missing file is a configuration error")
        void missingFile() throws Exception {
            Files.delete(file);

            assertThrows(ConfigException.class, () -> tracker("ready"));
        }

        @Test
        @DisplayName("duplicate ids are rejected")
        void duplicateIds() throws Exception {
            Files.writeString(file, """
                    {"version": 1, "tasks": [{"id": "1", "title": "a"}, {"id": "1", "title": "b"}]}
                    """);

            var e = assertThrows(ConfigException.class, () -> tracker("ready"));
            assertTrue(e.getMessage().contains("Duplicate task id 1"));
        }

        @Test
        @DisplayName("an unsupported version is rejected")
        void wrongVersion() throws Exception {
            Files.writeString(file, "{\"version\": 2, \"tasks\": []}");

            assertThrows(ConfigException.class, () -> tracker("ready"));
        }

        @Test
        @DisplayName("malformed JSON names the parse problem")
        void malformedJson() throws Exception {
            Files.writeString(file, "{\"version\": 1, \"tasks\": [");

            var e = assertThrows(ConfigException.class, () -> tracker("ready"));
            assertTrue(e.getMessage().contains("is not valid JSON"));
        }

        @Test
        @DisplayName("a path that cannot be read as a file is a configuration error")
        void unreadable() throws Exception {
            Files.delete(file);
            Files.createDirectory(file);

            var e = assertThrows(ConfigException.class, () -> tracker("ready"));
            assertTrue(e.getMessage().contains("could not be read"));
        }
    }
}
