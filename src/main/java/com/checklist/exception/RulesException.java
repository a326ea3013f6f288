package com.checklist.exception;

/**
 * Base exception for checklist rule processing.
 */
public class RulesException extends RuntimeException {

    public RulesException(String message) {
        super(message);
    }

    public RulesException(String message, Throwable cause) {
        super(message, cause);
    }
}
