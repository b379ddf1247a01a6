package com.formula.cli;

/**
 * How the console prints analysis results.
 */
public enum OutputFormat {
    /**
     * Human-readable lines with the mass to 7 decimals.
     */
    TEXT,

    /**
     * One JSON object per formula.
     */
    JSON
}
