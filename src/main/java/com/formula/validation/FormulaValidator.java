package com.formula.validation;

import com.formula.exception.EmptyFormulaException;
import com.formula.exception.InvalidTokenException;
import com.formula.exception.UnknownSymbolException;
import com.formula.parser.FormulaSyntax;
import com.formula.parser.Token;
import com.formula.table.AtomicMassTable;

import java.util.List;

/**
 * Checks formula tokens against the symbols of an atomic mass table.
 * <p>
 * Accepted tokens are parentheses, digit runs and element symbols present in the table.
 * Rejections are classified:
 * <ul>
 *   <li>a token that is not alphabetic, such as {@code $} or {@code +}: {@link InvalidTokenException}</li>
 *   <li>an alphabetic token missing from the table, such as {@code Xx} or a stray {@code x}:
 *       {@link UnknownSymbolException}</li>
 * </ul>
 * Parenthesis balance is the parser's concern, not the validator's.
 */
public class FormulaValidator {

    private final AtomicMassTable table;

    public FormulaValidator(AtomicMassTable table) {
        this.table = table;
    }

    /**
     * Validate tokens in order, failing on the first rejected one.
     *
     * @param input  Formula the tokens were scanned from, used in messages
     * @param tokens Tokens to check
     * @throws EmptyFormulaException  if there are no tokens
     * @throws InvalidTokenException  if a non-alphabetic token is not accepted
     * @throws UnknownSymbolException if an alphabetic token is not in the table
     */
    public void validate(String input, List<Token> tokens) {
        if (tokens.isEmpty()) {
            throw new EmptyFormulaException("Formula is empty: '" + input + "'");
        }

        for (Token token : tokens) {
            if (isValid(token)) {
                continue;
            }
            String message = "Invalid formula at position " + token.position()
                    + ": bad symbol '" + token.text() + "' in '" + input + "'";
            if (FormulaSyntax.isAlphabetic(token.text())) {
                throw new UnknownSymbolException(token.text(), message);
            }
            throw new InvalidTokenException(token, message);
        }
    }

    /**
     * Check a single token without throwing.
     *
     * @param token Token to check
     * @return true for parentheses, digit runs and known element symbols
     */
    public boolean isValid(Token token) {
        return switch (token.type()) {
            case LPAREN, RPAREN, NUMBER -> true;
            case ELEMENT -> table.contains(token.text());
            case OTHER -> false;
        };
    }
}
