package com.taskloop.core.tracker;

import com.taskloop.core.TaskloopException;

/**
 * Transient connectivity or server failure while talking to a remote tracker.
 * Recoverable: callers fall back to cached data where they have it.
 */
public class TrackerNetworkException extends TaskloopException {

    public TrackerNetworkException(String message) {
        super(message);
    }

    public TrackerNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
