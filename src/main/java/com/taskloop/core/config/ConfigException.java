package com.taskloop.core.config;

import com.taskloop.core.TaskloopException;

/**
 * Invalid or unknown configuration value. Always raised before any iteration runs.
 */
public class ConfigException extends TaskloopException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
