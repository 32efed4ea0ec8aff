package com.taskloop.core.model;

/**
 * How a single iteration ended.
 */
public enum IterationOutcome {
    DONE,       // gates passed and the tracker committed completion
    BLOCKED,    // open tasks remain but none is eligible
    FAILED,     // agent, gate or commit failure; task left open
    NO_TASK     // backlog exhausted
}
