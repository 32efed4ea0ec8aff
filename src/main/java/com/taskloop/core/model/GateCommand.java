package com.taskloop.core.model;

/**
 * A shell command that must exit with status zero before a task may be marked done.
 *
 * @param name           display name (defaults to the command itself)
 * @param command        shell command line
 * @param timeoutSeconds maximum run time before the gate counts as failed
 */
public record GateCommand(String name, String command, int timeoutSeconds) {

    public static GateCommand of(String command, int timeoutSeconds) {
        return new GateCommand(command, command, timeoutSeconds);
    }
}
