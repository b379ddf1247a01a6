package com.formula.parser;

/**
 * Lexical constants for formula parsing.
 */
public final class FormulaSyntax {

    private FormulaSyntax() {
    }

    /**
     * Deepest group nesting accepted by default.
     */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

    /**
     * Delimiter symbols.
     */
    public static final class Delimiters {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';

        private Delimiters() {
        }
    }

    /**
     * Character ranges making up element symbols and multipliers.
     * ASCII only: "Ca" is a symbol, a full-width letter is not.
     */
    public static final class Ranges {
        public static final char UPPER_FIRST = 'A';
        public static final char UPPER_LAST = 'Z';
        public static final char LOWER_FIRST = 'a';
        public static final char LOWER_LAST = 'z';
        public static final char DIGIT_FIRST = '0';
        public static final char DIGIT_LAST = '9';

        private Ranges() {
        }
    }

    /**
     * Check whether token text is made of letters only, such as "Xx" or a stray "x".
     * Such a token names an unknown element rather than a malformed character.
     */
    public static boolean isAlphabetic(String text) {
        return !text.isEmpty() && text.chars().allMatch(Character::isLetter);
    }
}
