package com.formula.validation;

import com.formula.parser.FormulaTokenizer;
import com.formula.parser.Token;

import java.util.stream.Collectors;

/**
 * Best-effort cleanup of formula strings.
 * Drops every token the validator would reject and joins the rest in order.
 * Parentheses are not rebalanced, so the result may still fail to parse.
 */
public class FormulaSanitizer {

    private final FormulaValidator validator;

    public FormulaSanitizer(FormulaValidator validator) {
        this.validator = validator;
    }

    /**
     * Return a copy of the formula with rejected tokens and whitespace removed.
     * Never fails.
     *
     * @param formula Formula string
     * @return Filtered formula, possibly empty
     */
    public String cleanCopy(String formula) {
        return new FormulaTokenizer(formula).tokenize().stream()
                .filter(validator::isValid)
                .map(Token::text)
                .collect(Collectors.joining());
    }
}
