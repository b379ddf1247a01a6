package com.formula.exception;

/**
 * Exception thrown when a formula contains no tokens at all.
 */
public class EmptyFormulaException extends FormulaException {

    public EmptyFormulaException(String message) {
        super(message);
    }
}
