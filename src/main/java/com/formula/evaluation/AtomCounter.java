package com.formula.evaluation;

import com.formula.exception.FormulaException;
import com.formula.exception.UnknownSymbolException;
import com.formula.table.AtomicMassTable;
import com.formula.tree.FormulaNode;
import com.formula.tree.FormulaTree;
import com.formula.tree.GroupNode;
import com.formula.tree.SymbolNode;

/**
 * Counts the atoms of one element in a formula tree, multiplying through groups.
 * For example "Be3Al2(SiO3)6" holds 18 oxygen atoms.
 */
public class AtomCounter {

    private final AtomicMassTable table;

    public AtomCounter(AtomicMassTable table) {
        this.table = table;
    }

    /**
     * Count atoms of {@code symbol} in the tree.
     *
     * @param tree   Parsed formula
     * @param symbol Element to count
     * @return Number of atoms, 0 if the element does not occur
     * @throws UnknownSymbolException if {@code symbol} is not in the table, even when the
     *                                count would be 0, or if the tree holds an unknown symbol
     */
    public int countAtoms(FormulaTree tree, String symbol) {
        requireKnown(symbol);
        try {
            return count(tree, symbol);
        } catch (ArithmeticException e) {
            throw new FormulaException("Atom count of '" + symbol + "' overflows in '" + tree + "'", e);
        }
    }

    /**
     * Reject a queried symbol that is not in the table.
     *
     * @throws UnknownSymbolException if the table has no such element
     */
    public void requireKnown(String symbol) {
        if (!table.contains(symbol)) {
            throw new UnknownSymbolException(symbol, "Not in periodic table: '" + symbol + "'");
        }
    }

    private int count(FormulaTree tree, String symbol) {
        int total = 0;
        for (FormulaNode node : tree.nodes()) {
            total = Math.addExact(total, count(node, symbol));
        }
        return total;
    }

    private int count(FormulaNode node, String symbol) {
        if (node instanceof SymbolNode leaf) {
            if (!table.contains(leaf.symbol())) {
                throw new UnknownSymbolException(leaf.symbol());
            }
            return leaf.symbol().equals(symbol) ? leaf.multiplier() : 0;
        }
        GroupNode group = (GroupNode) node;
        return Math.multiplyExact(count(group.tree(), symbol), group.multiplier());
    }
}
