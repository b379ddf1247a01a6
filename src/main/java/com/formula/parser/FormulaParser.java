package com.formula.parser;

import com.formula.exception.EmptyFormulaException;
import com.formula.exception.InvalidTokenException;
import com.formula.exception.NestingTooDeepException;
import com.formula.exception.UnbalancedParenthesesException;
import com.formula.exception.UnknownSymbolException;
import com.formula.tree.FormulaNode;
import com.formula.tree.FormulaTree;
import com.formula.tree.GroupNode;
import com.formula.tree.SymbolNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for chemical formulas.
 * Converts tokens into a FormulaTree using recursive descent parsing.
 * <p>
 * Grammar:
 * <pre>
 * formula    := item+
 * item       := (ELEMENT | '(' formula? ')') multiplier?
 * multiplier := NUMBER
 * </pre>
 * Symbols are not looked up in any mass table, so "Xx2" parses into a symbol node.
 * Recursion is bounded by {@code maxDepth} group levels.
 */
public final class FormulaParser {

    private final String input;
    private final List<Token> tokens;
    private final int maxDepth;
    private int index;

    public FormulaParser(String input, List<Token> tokens) {
        this(input, tokens, FormulaSyntax.DEFAULT_MAX_NESTING_DEPTH);
    }

    public FormulaParser(String input, List<Token> tokens, int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative, got " + maxDepth);
        }
        this.input = input;
        this.tokens = tokens;
        this.maxDepth = maxDepth;
        this.index = 0;
    }

    /**
     * Parse the token stream into a FormulaTree.
     *
     * @return Root of the formula tree
     */
    public FormulaTree parse() {
        if (tokens.isEmpty()) {
            throw new EmptyFormulaException("Formula is empty: '" + input + "'");
        }

        FormulaTree tree = parseFormula(0);

        // parseFormula only stops early on a ')' that no group opened
        if (!isAtEnd()) {
            Token stray = peek();
            throw new UnbalancedParenthesesException(stray.position(),
                    message(stray.position(), "Unmatched ')'"));
        }
        return tree;
    }

    private FormulaTree parseFormula(int depth) {
        List<FormulaNode> nodes = new ArrayList<>();

        while (!isAtEnd() && !check(TokenType.RPAREN)) {
            nodes.add(parseItem(depth));
        }

        return new FormulaTree(nodes);
    }

    private FormulaNode parseItem(int depth) {
        Token token = advance();

        return switch (token.type()) {
            case ELEMENT -> new SymbolNode(token.text(), parseMultiplier());
            case LPAREN -> parseGroup(token, depth + 1);
            case NUMBER -> throw error(token, "Multiplier '" + token.text()
                    + "' does not follow an element or group");
            default -> throw unexpected(token);
        };
    }

    private GroupNode parseGroup(Token open, int depth) {
        if (depth > maxDepth) {
            throw new NestingTooDeepException(maxDepth,
                    message(open.position(), "Groups nested deeper than " + maxDepth + " levels"));
        }

        FormulaTree inner = parseFormula(depth);

        if (!match(TokenType.RPAREN)) {
            throw new UnbalancedParenthesesException(open.position(),
                    message(open.position(), "Unclosed '('"));
        }

        return new GroupNode(inner, parseMultiplier());
    }

    private int parseMultiplier() {
        if (!match(TokenType.NUMBER)) {
            return 1;
        }

        Token token = previous();
        int value;
        try {
            value = Integer.parseInt(token.text());
        } catch (NumberFormatException e) {
            throw error(token, "Multiplier '" + token.text() + "' is out of range");
        }

        if (value < 1) {
            throw error(token, "Multiplier must be positive, got '" + token.text() + "'");
        }
        return value;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return !isAtEnd() && peek().type() == type;
    }

    private Token advance() {
        return tokens.get(index++);
    }

    private boolean isAtEnd() {
        return index >= tokens.size();
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private RuntimeException unexpected(Token token) {
        if (FormulaSyntax.isAlphabetic(token.text())) {
            return new UnknownSymbolException(token.text(),
                    message(token.position(), "Unknown symbol '" + token.text() + "'"));
        }
        return error(token, "Unexpected character '" + token.text() + "'");
    }

    private InvalidTokenException error(Token token, String message) {
        return new InvalidTokenException(token, message(token.position(), message));
    }

    private String message(int position, String message) {
        return "Invalid formula at position " + position + ": " + message + " in '" + input + "'";
    }
}
