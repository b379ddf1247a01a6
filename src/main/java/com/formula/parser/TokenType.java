package com.formula.parser;

/**
 * Token types for formula scanning.
 */
public enum TokenType {
    // Element symbol, e.g. "Ca"
    ELEMENT,

    // Digit run, used as a multiplier
    NUMBER,

    // Delimiters
    LPAREN,
    RPAREN,

    // Any other single non-whitespace character
    OTHER
}
