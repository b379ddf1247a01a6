package com.formula.exception;

/**
 * Exception thrown when groups are nested deeper than the parser allows.
 */
public class NestingTooDeepException extends FormulaException {

    private final int maxDepth;

    public NestingTooDeepException(int maxDepth, String message) {
        super(message);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
