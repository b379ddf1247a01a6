package com.formula.tree;

import java.util.Objects;

/**
 * Leaf node holding an element symbol.
 * The symbol is not checked against any mass table here.
 *
 * @param symbol     Element symbol as written, e.g. "Ca"
 * @param multiplier Positive atom count
 */
public record SymbolNode(String symbol, int multiplier) implements FormulaNode {

    public SymbolNode {
        Objects.requireNonNull(symbol, "symbol");
        if (multiplier < 1) {
            throw new IllegalArgumentException("Multiplier must be positive, got " + multiplier);
        }
    }

    @Override
    public String toString() {
        return multiplier == 1 ? symbol : symbol + multiplier;
    }
}
