package com.formula.parser;

import java.util.ArrayList;
import java.util.List;

import static com.formula.parser.FormulaSyntax.*;

/**
 * Tokenizer for chemical formulas.
 * Converts input string into a sequence of tokens.
 * <p>
 * Scanning never fails: characters that cannot start a symbol, a multiplier or a
 * parenthesis become {@link TokenType#OTHER} tokens so that validation can report them.
 */
public final class FormulaTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public FormulaTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens in source order
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            // Skip whitespace
            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Delimiters.LEFT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", start));
                }
                case Delimiters.RIGHT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", start));
                }
                default -> {
                    if (isUpper(c)) {
                        tokens.add(readElement());
                    } else if (isDigit(c)) {
                        tokens.add(readNumber());
                    } else {
                        advance();
                        tokens.add(new Token(TokenType.OTHER, String.valueOf(c), start));
                    }
                }
            }
        }

        return tokens;
    }

    private Token readElement() {
        int start = pos;
        advance();

        while (!isAtEnd() && isLower(peek())) {
            advance();
        }

        return new Token(TokenType.ELEMENT, input.substring(start, pos), start);
    }

    private Token readNumber() {
        int start = pos;

        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }

        return new Token(TokenType.NUMBER, input.substring(start, pos), start);
    }

    private static boolean isUpper(char c) {
        return c >= Ranges.UPPER_FIRST && c <= Ranges.UPPER_LAST;
    }

    private static boolean isLower(char c) {
        return c >= Ranges.LOWER_FIRST && c <= Ranges.LOWER_LAST;
    }

    private static boolean isDigit(char c) {
        return c >= Ranges.DIGIT_FIRST && c <= Ranges.DIGIT_LAST;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
