package com.formula.tree;

import java.util.Objects;

/**
 * Node holding a parenthesized sub-formula, exclusively owned by this node.
 *
 * @param tree       Contents of the group
 * @param multiplier Positive repeat count of the whole group
 */
public record GroupNode(FormulaTree tree, int multiplier) implements FormulaNode {

    public GroupNode {
        Objects.requireNonNull(tree, "tree");
        if (multiplier < 1) {
            throw new IllegalArgumentException("Multiplier must be positive, got " + multiplier);
        }
    }

    @Override
    public String toString() {
        String group = "(" + tree + ")";
        return multiplier == 1 ? group : group + multiplier;
    }
}
