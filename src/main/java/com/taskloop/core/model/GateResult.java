package com.taskloop.core.model;

/**
 * Outcome of running one gate command.
 *
 * @param name       gate display name
 * @param command    the command that ran
 * @param exitCode   process exit status (-1 when the process could not start)
 * @param timedOut   whether the gate was killed for exceeding its timeout
 * @param durationMs wall-clock run time
 * @param output     combined stdout/stderr, truncated
 */
public record GateResult(
    String name,
    String command,
    int exitCode,
    boolean timedOut,
    long durationMs,
    String output
) {

    public boolean passed() {
        return exitCode == 0 && !timedOut;
    }
}
