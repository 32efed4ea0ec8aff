package com.taskloop.core.model;

/**
 * Backlog size as seen by a tracker.
 *
 * @param open  tasks that are not closed (eligible or not)
 * @param total all tasks the tracker knows about
 */
public record TaskCounts(int open, int total) {

    public int closed() {
        return total - open;
    }
}
