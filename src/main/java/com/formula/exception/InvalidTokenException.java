package com.formula.exception;

import com.formula.parser.Token;

/**
 * Exception thrown when a formula contains a token that is syntactically malformed
 * or misplaced: a character that is neither a letter, a digit nor a parenthesis,
 * a multiplier with nothing to multiply, or a multiplier that is not a positive int.
 */
public class InvalidTokenException extends FormulaException {

    private final Token token;

    public InvalidTokenException(Token token, String message) {
        super(message);
        this.token = token;
    }

    public Token getToken() {
        return token;
    }
}
