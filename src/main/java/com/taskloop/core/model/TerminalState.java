package com.taskloop.core.model;

/**
 * Why a run stopped iterating.
 */
public enum TerminalState {
    DONE,           // every task is closed
    BLOCKED,        // open tasks remain, none eligible
    NO_PROGRESS,    // no_progress_limit consecutive iterations without a commit
    LIMIT_REACHED,  // max_iterations used up
    STOPPED         // stop requested through the control surface
}
