package com.constraint.exception;

/**
 * Exception thrown when a constraint configuration file is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends ConstraintException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
