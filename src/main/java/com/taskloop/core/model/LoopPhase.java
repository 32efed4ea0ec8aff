package com.taskloop.core.model;

/**
 * Phases of the per-iteration state machine.
 */
public enum LoopPhase {
    IDLE,
    SELECT,
    EXECUTE,
    GATE,
    COMMIT,
    ROLLBACK
}
