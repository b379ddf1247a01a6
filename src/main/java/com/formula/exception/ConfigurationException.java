package com.formula.exception;

/**
 * Exception thrown when configuration or the atomic mass table is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends FormulaException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
