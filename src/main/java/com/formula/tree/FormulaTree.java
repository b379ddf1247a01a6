package com.formula.tree;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered sequence of formula nodes, in the order they appear in the source string.
 *
 * @param nodes Top-level nodes of this tree
 */
public record FormulaTree(List<FormulaNode> nodes) {

    public FormulaTree {
        nodes = List.copyOf(nodes);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Get the number of group levels below this tree (0 when it holds symbols only).
     */
    public int depth() {
        int max = 0;
        for (FormulaNode node : nodes) {
            if (node instanceof GroupNode group) {
                max = Math.max(max, group.tree().depth() + 1);
            }
        }
        return max;
    }

    /**
     * Render the tree back to formula text, e.g. "Ca(NO3)2".
     */
    @Override
    public String toString() {
        return nodes.stream()
                .map(FormulaNode::toString)
                .collect(Collectors.joining());
    }
}
