package com.taskloop.dispatch.cli;

import com.taskloop.core.TaskloopException;
import com.taskloop.core.model.LoopOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an exception that escaped a command into a message and exit code 2.
 */
public final class CliFailures {

    private static final Logger log = LoggerFactory.getLogger(CliFailures.class);

    private CliFailures() {}

    static int report(String what, Throwable t) {
        log.debug("{} failed", what, t);
        ConsoleOutput.error(what + " failed: " + describe(t));
        return LoopOutcome.EXIT_FAILURE;
    }

    /**
     * Message of the outermost {@link TaskloopException}, falling back to the root cause. Bean
     * creation wraps errors raised while building the tracker, so the chain is walked.
     */
    public static String describe(Throwable t) {
        Throwable cause = t;
        Throwable taskloop = null;
        while (cause != null) {
            if (taskloop == null && cause instanceof TaskloopException) {
                taskloop = cause;
            }
            if (cause.getCause() == null || cause.getCause() == cause) {
                break;
            }
            cause = cause.getCause();
        }
        Throwable chosen = taskloop != null ? taskloop : cause;
        return chosen.getMessage() != null ? chosen.getMessage() : chosen.getClass().getSimpleName();
    }
}
