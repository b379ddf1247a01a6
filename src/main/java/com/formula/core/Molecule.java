package com.formula.core;

import com.formula.evaluation.AtomCounter;
import com.formula.evaluation.ElementEnumerator;
import com.formula.evaluation.MassEvaluator;
import com.formula.parser.FormulaParser;
import com.formula.parser.FormulaSyntax;
import com.formula.parser.FormulaTrees;
import com.formula.parser.Token;
import com.formula.table.AtomicMassTable;
import com.formula.tree.FormulaTree;
import com.formula.validation.FormulaSanitizer;
import com.formula.validation.FormulaValidator;

import java.util.List;
import java.util.Objects;

/**
 * A molecular formula bound to the atomic mass table it is evaluated against.
 * <p>
 * The formula text is kept as given; tokens and trees are rebuilt on every call.
 * <pre>
 * Molecule m = new Molecule("H2SO4");
 * m.mass();        // 98.0768
 * m.atoms("O");    // 4
 * for (ElementCount e : m.elements()) { ... }   // (H, 2), (O, 4), (S, 1)
 * </pre>
 */
public final class Molecule {

    private final String formula;
    private final AtomicMassTable table;
    private final int maxNestingDepth;

    public Molecule(String formula) {
        this(formula, AtomicMassTable.standard());
    }

    public Molecule(String formula, AtomicMassTable table) {
        this(formula, table, FormulaSyntax.DEFAULT_MAX_NESTING_DEPTH);
    }

    public Molecule(String formula, AtomicMassTable table, int maxNestingDepth) {
        this.formula = Objects.requireNonNull(formula, "formula");
        this.table = Objects.requireNonNull(table, "table");
        this.maxNestingDepth = maxNestingDepth;
    }

    public String formula() {
        return formula;
    }

    public AtomicMassTable table() {
        return table;
    }

    public List<Token> tokens() {
        return FormulaTrees.tokenize(formula);
    }

    /**
     * Parse the formula into a fresh tree. Symbols are not checked.
     */
    public FormulaTree tree() {
        return new FormulaParser(formula, tokens(), maxNestingDepth).parse();
    }

    /**
     * Check that every token is a parenthesis, a digit run or a known element.
     * This does not mean the molecule is chemically viable.
     *
     * @throws com.formula.exception.EmptyFormulaException  if the formula has no tokens
     * @throws com.formula.exception.InvalidTokenException  on a malformed character
     * @throws com.formula.exception.UnknownSymbolException on an unrecognized symbol
     */
    public void checkSymbols() {
        new FormulaValidator(table).validate(formula, tokens());
    }

    /**
     * Compute the molecular mass from the constituent atoms, validating first.
     *
     * @return Mass in atomic mass units
     */
    public double mass() {
        checkSymbols();
        return new MassEvaluator(table).mass(tree());
    }

    /**
     * Count the atoms of one element.
     *
     * @param symbol Element symbol, e.g. "O"
     * @return Number of atoms
     * @throws com.formula.exception.UnknownSymbolException if the symbol is not in the table,
     *                                                      checked before the formula is parsed
     */
    public int atoms(String symbol) {
        AtomCounter counter = new AtomCounter(table);
        counter.requireKnown(symbol);
        return counter.countAtoms(tree(), symbol);
    }

    /**
     * Enumerate the elements with their totals, sorted by symbol.
     * The returned sequence may be iterated any number of times.
     */
    public ElementEnumerator elements() {
        return new ElementEnumerator(formula, table, maxNestingDepth);
    }

    /**
     * Return a copy of the molecule with rejected tokens removed.
     */
    public Molecule cleanCopy() {
        String cleaned = new FormulaSanitizer(new FormulaValidator(table)).cleanCopy(formula);
        return new Molecule(cleaned, table, maxNestingDepth);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Molecule that = (Molecule) o;
        return formula.equals(that.formula) && table == that.table;
    }

    @Override
    public int hashCode() {
        return formula.hashCode();
    }

    @Override
    public String toString() {
        return formula;
    }
}
