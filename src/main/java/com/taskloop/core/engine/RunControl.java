package com.taskloop.core.engine;

import java.time.Duration;

/**
 * Cooperative stop and pause switches shared between a running loop and whoever controls it.
 * The loop only looks at them at its checkpoints.
 */
public class RunControl {

    private boolean stopRequested;
    private boolean paused;

    public synchronized void requestStop() {
        stopRequested = true;
        paused = false;
        notifyAll();
    }

    public synchronized void pause() {
        paused = true;
    }

    public synchronized void resume() {
        paused = false;
        notifyAll();
    }

    public synchronized boolean isStopRequested() {
        return stopRequested;
    }

    public synchronized boolean isPaused() {
        return paused;
    }

    /**
     * Blocks while paused.
     *
     * @return false when the loop should stop
     */
    public synchronized boolean checkpoint() {
        try {
            while (paused && !stopRequested) {
                wait();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
        }
        return !stopRequested;
    }

    /**
     * Sleeps for {@code duration} unless a stop arrives first.
     *
     * @return false when the loop should stop
     */
    public synchronized boolean sleep(Duration duration) {
        long deadline = System.nanoTime() + duration.toNanos();
        try {
            long remaining;
            while (!stopRequested && (remaining = deadline - System.nanoTime()) > 0) {
                wait(Math.max(1, remaining / 1_000_000));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
        }
        return !stopRequested;
    }
}
