package com.formula.core;

import com.formula.evaluation.ElementCount;

import java.util.List;

/**
 * Result of analysing one formula.
 *
 * @param formula  Formula as given
 * @param mass     Molecular mass in amu, unrounded
 * @param elements Element totals sorted by symbol
 */
public record MoleculeReport(
        String formula,
        double mass,
        List<ElementCount> elements
) {
    public MoleculeReport {
        elements = List.copyOf(elements);
    }
}
