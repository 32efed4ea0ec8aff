package com.taskloop.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while the loop runs, consumed by the console and the bridge.
 *
 * @param eventType one of the type constants, e.g. "iteration.started"
 * @param runId     the run this event belongs to
 * @param taskId    the task this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record LoopEvent(
    String eventType,
    String runId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String RUN_STARTED = "run.started";
    public static final String RUN_PAUSED = "run.paused";
    public static final String RUN_RESUMED = "run.resumed";
    public static final String RUN_STOPPED = "run.stopped";
    public static final String ITERATION_STARTED = "iteration.started";
    public static final String ITERATION_FINISHED = "iteration.finished";
    public static final String RUN_THROTTLED = "run.throttled";
    public static final String TASK_BLOCKED = "task.blocked";
    public static final String ERROR = "error";

    public LoopEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }
}
