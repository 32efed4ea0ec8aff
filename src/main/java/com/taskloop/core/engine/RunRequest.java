package com.taskloop.core.engine;

/**
 * Per-invocation overrides.
 *
 * @param mode          mode name, null for the configured one
 * @param maxIterations iteration cap, null for the mode's value
 */
public record RunRequest(String mode, Integer maxIterations) {

    public static final RunRequest DEFAULTS = new RunRequest(null, null);
}
