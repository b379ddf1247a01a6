package com.formula.evaluation;

/**
 * Total number of atoms of one element in a formula.
 *
 * @param symbol Element symbol
 * @param count  Number of atoms
 */
public record ElementCount(String symbol, int count) {

    @Override
    public String toString() {
        return "(" + symbol + ", " + count + ")";
    }
}
