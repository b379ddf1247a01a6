package com.formula.tree;

/**
 * A node of a formula tree: either an element symbol or a parenthesized group,
 * each carrying a positive multiplier.
 */
public sealed interface FormulaNode permits SymbolNode, GroupNode {

    /**
     * Get the multiplier attached to this node (1 when none was written).
     */
    int multiplier();
}
