package com.formula.evaluation;

import com.formula.table.AtomicMassTable;
import com.formula.tree.FormulaNode;
import com.formula.tree.FormulaTree;
import com.formula.tree.GroupNode;
import com.formula.tree.SymbolNode;

/**
 * Computes the molecular mass of a formula tree.
 * <p>
 * {@code mass(tree) = sum over nodes of (table[symbol] or mass(subtree)) * multiplier}.
 * The result is not rounded.
 */
public class MassEvaluator {

    private final AtomicMassTable table;

    public MassEvaluator(AtomicMassTable table) {
        this.table = table;
    }

    /**
     * Compute the mass of a tree in atomic mass units.
     *
     * @param tree Parsed formula
     * @return Molecular mass, 0 for an empty tree
     * @throws com.formula.exception.UnknownSymbolException at the first symbol (depth-first,
     *                                                      left to right) missing from the table
     */
    public double mass(FormulaTree tree) {
        double total = 0;
        for (FormulaNode node : tree.nodes()) {
            total += contribution(node);
        }
        return total;
    }

    private double contribution(FormulaNode node) {
        double nodeMass;
        if (node instanceof SymbolNode symbol) {
            nodeMass = table.mass(symbol.symbol());
        } else {
            nodeMass = mass(((GroupNode) node).tree());
        }
        return nodeMass * node.multiplier();
    }
}
