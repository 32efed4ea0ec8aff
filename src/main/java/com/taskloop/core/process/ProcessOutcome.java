package com.taskloop.core.process;

/**
 * Result of one external command.
 *
 * @param exitCode   process exit status, {@code -1} when it was killed after a timeout
 * @param timedOut   whether the timeout fired
 * @param output     combined stdout and stderr, tail-truncated
 * @param durationMs wall-clock duration
 */
public record ProcessOutcome(int exitCode, boolean timedOut, String output, long durationMs) {

    public boolean succeeded() {
        return exitCode == 0 && !timedOut;
    }
}
