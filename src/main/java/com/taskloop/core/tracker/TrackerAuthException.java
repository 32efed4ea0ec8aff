package com.taskloop.core.tracker;

import com.taskloop.core.TaskloopException;

/**
 * Missing or rejected credentials for a network-backed tracker. Fatal for the run.
 */
public class TrackerAuthException extends TaskloopException {

    public TrackerAuthException(String message) {
        super(message);
    }

    public TrackerAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
