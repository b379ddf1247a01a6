package com.formula.core;

import com.formula.evaluation.ElementCount;
import com.formula.table.AtomicMassTable;

import java.util.List;

/**
 * Main entry point for formula calculations against a configured mass table.
 */
public interface MoleculeAnalyzer {

    /**
     * Bind a formula to this analyzer's table and nesting limit.
     */
    Molecule molecule(String formula);

    /**
     * Validate a formula's tokens.
     *
     * @throws com.formula.exception.FormulaException describing the first rejected token
     */
    void validate(String formula);

    /**
     * Compute the molecular mass of a formula, validating first.
     */
    double mass(String formula);

    /**
     * Count atoms of one element in a formula.
     */
    int atoms(String formula, String symbol);

    /**
     * Get element totals sorted by symbol.
     */
    List<ElementCount> elements(String formula);

    /**
     * Drop rejected tokens from a formula. Never fails.
     */
    String cleanCopy(String formula);

    /**
     * Compute mass and element totals in one go.
     */
    MoleculeReport analyze(String formula);

    /**
     * Get the atomic mass table in use.
     */
    AtomicMassTable getTable();
}
