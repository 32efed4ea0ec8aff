package com.taskloop.core;

/**
 * Base class for every failure raised by the loop core.
 */
public class TaskloopException extends RuntimeException {

    public TaskloopException(String message) {
        super(message);
    }

    public TaskloopException(String message, Throwable cause) {
        super(message, cause);
    }
}
