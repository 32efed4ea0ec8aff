package com.taskloop.core.tracker.local;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.taskloop.core.config.ConfigException;
import com.taskloop.core.io.AtomicFiles;
import com.taskloop.core.model.SelectedTask;
import com.taskloop.core.model.TaskCounts;
import com.taskloop.core.tracker.PartialUpdateException;
import com.taskloop.core.tracker.TaskFilter;
import com.taskloop.core.tracker.TaskNotFoundException;
import com.taskloop.core.tracker.TaskPriority;
import com.taskloop.core.tracker.TaskTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Tracker backed by a JSON task file in the project.
 * <p>
 * The file is re-read before every operation so edits made by the agent or by hand are
 * picked up. Mutations rewrite the whole file atomically; a failed write leaves both the
 * file and the in-memory document untouched.
 */
public class LocalFileTracker implements TaskTracker {

    private static final Logger log = LoggerFactory.getLogger(LocalFileTracker.class);

    private final Path file;
    private final TaskFilter filter;
    private final List<String> doneLabels;
    private final String blockLabel;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private LocalTaskDocument document;

    public LocalFileTracker(Path file, TaskFilter filter, List<String> doneLabels, String blockLabel,
                            ObjectMapper objectMapper, Clock clock) {
        this.file = file;
        this.filter = filter;
        this.doneLabels = List.copyOf(doneLabels);
        this.blockLabel = blockLabel;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
        this.document = load();
    }

    @Override
    public String kind() {
        return "local";
    }

    @Override
    public synchronized Optional<SelectedTask> claimNextTask(Set<String> skipIds) {
        document = load();
        Set<String> closedIds = document.tasks().stream()
                .filter(LocalTaskEntry::done)
                .map(LocalTaskEntry::id)
                .collect(Collectors.toSet());

        return document.tasks().stream()
                .filter(entry -> !skipIds.contains(entry.id()))
                .filter(entry -> dependenciesMet(entry, closedIds))
                .map(LocalTaskEntry::toTask)
                .filter(filter::isEligible)
                .min(TaskPriority.ORDER)
                .map(task -> {
                    log.debug("Selected local task {} ({})", task.id(), task.title());
                    return new SelectedTask(task, clock.instant());
                });
    }

    @Override
    public synchronized boolean isTaskDone(String taskId) {
        document = load();
        return find(taskId).done();
    }

    @Override
    public synchronized void forceTaskOpen(String taskId) {
        document = load();
        var entry = find(taskId);
        boolean hasDoneLabel = entry.labelsOrEmpty().stream().anyMatch(doneLabels::contains);
        if (!entry.done() && !hasDoneLabel) {
            log.debug("Task {} already open", taskId);
            return;
        }
        var updated = document.replacing(entry.reopenedWithout(doneLabels));
        try {
            persist(updated);
        } catch (IOException e) {
            throw new PartialUpdateException(taskId, "reopen", true, e);
        }
        log.info("Reopened local task {}", taskId);
    }

    @Override
    public synchronized void markTaskDone(String taskId, String comment) {
        document = load();
        var entry = find(taskId);
        if (entry.done()) {
            log.info("Task {} already completed; nothing to commit", taskId);
            return;
        }
        var updated = document.replacing(entry.completedWith(doneLabels, comment));
        try {
            persist(updated);
        } catch (IOException e) {
            // the file was never replaced, so the prior state is intact
            throw new PartialUpdateException(taskId, "write", true, e);
        }
        log.info("Marked local task {} done", taskId);
    }

    /**
     * Adds the block label and records {@code reason} as {@code blocked_reason}.
     */
    @Override
    public synchronized boolean blockTask(String taskId, String reason) {
        document = load();
        var entry = find(taskId);
        var blocked = entry.blockedWith(blockLabel, reason);
        if (blocked.equals(entry)) {
            return false;
        }
        try {
            persist(document.replacing(blocked));
        } catch (IOException e) {
            log.error("Could not block local task {}: {}", taskId, e.getMessage());
            return false;
        }
        log.info("Blocked local task {}: {}", taskId, reason);
        return true;
    }

    @Override
    public synchronized TaskCounts counts() {
        document = load();
        int total = document.tasks().size();
        int open = (int) document.tasks().stream().filter(t -> !t.done()).count();
        return new TaskCounts(open, total);
    }

    private boolean dependenciesMet(LocalTaskEntry entry, Set<String> closedIds) {
        for (String dep : entry.dependsOnOrEmpty()) {
            if (!closedIds.contains(dep)) {
                return false;
            }
        }
        return true;
    }

    private LocalTaskEntry find(String taskId) {
        return document.tasks().stream()
                .filter(t -> t.id().equals(taskId))
                .findFirst()
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private void persist(LocalTaskDocument updated) throws IOException {
        AtomicFiles.write(file, objectMapper.writeValueAsBytes(updated));
        document = updated;
    }

    private LocalTaskDocument load() {
        if (!Files.exists(file)) {
            throw new ConfigException("Task file not found: " + file);
        }
        LocalTaskDocument loaded;
        try {
            loaded = objectMapper.readValue(file.toFile(), LocalTaskDocument.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Task file " + file + " is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Task file " + file + " could not be read: " + e.getMessage(), e);
        }
        validate(loaded);
        return loaded;
    }

    private void validate(LocalTaskDocument doc) {
        if (doc == null || doc.version() == null || doc.version() != LocalTaskDocument.CURRENT_VERSION) {
            throw new ConfigException("Unsupported task file version in %s: %s (expected %d)"
                    .formatted(file, doc == null ? null : doc.version(), LocalTaskDocument.CURRENT_VERSION));
        }
        if (doc.tasks() == null) {
            throw new ConfigException("Task file " + file + " must have a 'tasks' list");
        }
        var seen = new HashSet<String>();
        for (int i = 0; i < doc.tasks().size(); i++) {
            var task = doc.tasks().get(i);
            if (task == null || task.id() == null || task.id().isBlank()) {
                throw new ConfigException("Task at index %d in %s is missing 'id'".formatted(i, file));
            }
            if (task.title() == null || task.title().isBlank()) {
                throw new ConfigException("Task %s in %s is missing 'title'".formatted(task.id(), file));
            }
            if (!seen.add(task.id())) {
                throw new ConfigException("Duplicate task id %s in %s".formatted(task.id(), file));
            }
        }
        Map<String, LocalTaskEntry> byId = doc.tasks().stream()
                .collect(Collectors.toMap(LocalTaskEntry::id, Function.identity()));
        for (var task : doc.tasks()) {
            for (String dep : task.dependsOnOrEmpty()) {
                if (!byId.containsKey(dep)) {
                    log.warn("Task {} depends on unknown task {}; it will never become eligible", task.id(), dep);
                }
            }
        }
    }
}
