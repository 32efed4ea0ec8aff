package com.taskloop.core.agent;

/**
 * @param exitCode   agent exit status, -1 when it could not be started or was killed
 * @param timedOut   whether the timeout fired
 * @param output     tail of the agent's combined output
 * @param durationMs wall-clock run time
 */
public record AgentResult(int exitCode, boolean timedOut, String output, long durationMs) {

    public boolean succeeded() {
        return exitCode == 0 && !timedOut;
    }
}
