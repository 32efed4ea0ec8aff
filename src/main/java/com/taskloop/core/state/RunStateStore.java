package com.taskloop.core.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.taskloop.core.TaskloopException;
import com.taskloop.core.io.AtomicFiles;
import com.taskloop.core.model.IterationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;

/**
 * Loads, merges and atomically persists {@link RunState}.
 * <p>
 * Every append re-reads the file first so results written by another invocation are kept.
 * An unreadable file is moved aside and a fresh state is started.
 */
public class RunStateStore {

    private static final Logger log = LoggerFactory.getLogger(RunStateStore.class);

    static final int MAX_HISTORY = 500;

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RunStateStore(Path file, ObjectMapper objectMapper, Clock clock) {
        this.file = file;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    public Path file() {
        return file;
    }

    public synchronized RunState load() {
        if (!Files.exists(file)) {
            return RunState.fresh(clock.instant());
        }
        try {
            RunState state = objectMapper.readValue(file.toFile(), RunState.class);
            if (state == null) {
                return RunState.fresh(clock.instant());
            }
            return state.createdAt() == null ? state.withCreatedAt(clock.instant()) : state;
        } catch (IOException e) {
            Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + clock.millis());
            log.warn("State file {} is unreadable ({}); moving it to {} and starting fresh",
                    file, e.getMessage(), aside.getFileName());
            moveAside(aside);
            return RunState.fresh(clock.instant());
        }
    }

    public int nextIteration() {
        return load().lastIteration() + 1;
    }

    public synchronized RunState append(IterationResult result, int noProgressStreak) {
        RunState merged = load().appending(result, noProgressStreak, MAX_HISTORY);
        persist(merged);
        return merged;
    }

    /**
     * Records that the loop gave up on {@code taskId}.
     */
    public synchronized RunState markBlocked(String taskId, BlockedTask blocked) {
        RunState updated = load().withBlocked(taskId, blocked);
        persist(updated);
        return updated;
    }

    public synchronized RunState resetStreak() {
        RunState state = load();
        if (state.noProgressStreak() == 0 && Files.exists(file)) {
            return state;
        }
        RunState reset = state.withStreak(0);
        persist(reset);
        return reset;
    }

    public synchronized void persist(RunState state) {
        try {
            AtomicFiles.write(file, objectMapper.writeValueAsBytes(state));
        } catch (IOException e) {
            throw new TaskloopException("Could not write state file " + file + ": " + e.getMessage(), e);
        }
    }

    private void moveAside(Path aside) {
        try {
            Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new TaskloopException("Could not move unreadable state file " + file + " aside", e);
        }
    }
}
