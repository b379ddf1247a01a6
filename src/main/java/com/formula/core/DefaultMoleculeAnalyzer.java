package com.formula.core;

import com.formula.evaluation.ElementCount;
import com.formula.table.AtomicMassTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Default MoleculeAnalyzer implementation.
 * Holds no per-formula state; safe to share between threads.
 */
public class DefaultMoleculeAnalyzer implements MoleculeAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DefaultMoleculeAnalyzer.class);

    private final AtomicMassTable table;
    private final int maxNestingDepth;

    public DefaultMoleculeAnalyzer(AtomicMassTable table, int maxNestingDepth) {
        this.table = table;
        this.maxNestingDepth = maxNestingDepth;
        log.debug("Created analyzer with {} elements, max nesting depth {}", table.size(), maxNestingDepth);
    }

    @Override
    public Molecule molecule(String formula) {
        return new Molecule(formula, table, maxNestingDepth);
    }

    @Override
    public void validate(String formula) {
        molecule(formula).checkSymbols();
    }

    @Override
    public double mass(String formula) {
        double mass = molecule(formula).mass();
        log.debug("Mass of {} = {}", formula, mass);
        return mass;
    }

    @Override
    public int atoms(String formula, String symbol) {
        int count = molecule(formula).atoms(symbol);
        log.debug("Atoms of {} in {} = {}", symbol, formula, count);
        return count;
    }

    @Override
    public List<ElementCount> elements(String formula) {
        return molecule(formula).elements().toList();
    }

    @Override
    public String cleanCopy(String formula) {
        String cleaned = molecule(formula).cleanCopy().formula();
        if (!cleaned.equals(formula)) {
            log.debug("Cleaned formula '{}' to '{}'", formula, cleaned);
        }
        return cleaned;
    }

    @Override
    public MoleculeReport analyze(String formula) {
        Molecule molecule = molecule(formula);
        double mass = molecule.mass();
        List<ElementCount> elements = molecule.elements().toList();

        log.debug("Analyzed {}: mass={}, elements={}", formula, mass, elements);
        return new MoleculeReport(formula, mass, elements);
    }

    @Override
    public AtomicMassTable getTable() {
        return table;
    }
}
