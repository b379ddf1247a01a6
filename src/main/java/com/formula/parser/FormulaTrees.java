package com.formula.parser;

import com.formula.tree.FormulaTree;

import java.util.List;

/**
 * Facade for turning formula strings into FormulaTree instances.
 * Every call tokenizes and parses afresh; nothing is cached.
 */
public final class FormulaTrees {

    private FormulaTrees() {
    }

    /**
     * Parse a formula with the default nesting limit.
     *
     * @param formula Formula string, e.g. "Ca(NO3)2"
     * @return Parsed formula tree
     */
    public static FormulaTree parse(String formula) {
        return parse(formula, FormulaSyntax.DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * Parse a formula, rejecting groups nested deeper than {@code maxDepth}.
     *
     * @param formula  Formula string
     * @param maxDepth Deepest accepted group nesting
     * @return Parsed formula tree
     */
    public static FormulaTree parse(String formula, int maxDepth) {
        List<Token> tokens = tokenize(formula);
        return new FormulaParser(formula, tokens, maxDepth).parse();
    }

    /**
     * Tokenize a formula.
     *
     * @param formula Formula string
     * @return Tokens in source order
     */
    public static List<Token> tokenize(String formula) {
        return new FormulaTokenizer(formula).tokenize();
    }
}
