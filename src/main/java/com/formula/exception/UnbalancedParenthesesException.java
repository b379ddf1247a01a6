package com.formula.exception;

/**
 * Exception thrown when a group is opened and never closed, or closed without being opened.
 */
public class UnbalancedParenthesesException extends FormulaException {

    private final int position;

    public UnbalancedParenthesesException(int position, String message) {
        super(message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
