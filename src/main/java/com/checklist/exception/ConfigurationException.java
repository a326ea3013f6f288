package com.checklist.exception;

/**
 * Exception thrown when rule dialect configuration is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends RulesException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
