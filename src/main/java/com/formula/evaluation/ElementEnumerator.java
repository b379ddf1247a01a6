package com.formula.evaluation;

import com.formula.parser.FormulaParser;
import com.formula.parser.FormulaTokenizer;
import com.formula.parser.Token;
import com.formula.parser.TokenType;
import com.formula.table.AtomicMassTable;
import com.formula.tree.FormulaTree;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Enumerates the distinct elements of a formula with their total atom counts,
 * sorted by symbol. "Be3Al2(SiO3)6" yields (Al, 2), (Be, 3), (O, 18), (Si, 6).
 * <p>
 * Elements are discovered from the raw tokens; only symbols present in the table are
 * listed. Every {@link #iterator()} call rescans and reparses the formula, so iterators
 * are independent and the enumeration can be repeated.
 */
public class ElementEnumerator implements Iterable<ElementCount> {

    private final String formula;
    private final AtomicMassTable table;
    private final int maxDepth;

    public ElementEnumerator(String formula, AtomicMassTable table, int maxDepth) {
        this.formula = formula;
        this.table = table;
        this.maxDepth = maxDepth;
    }

    /**
     * Start a new enumeration.
     * The formula is parsed here; atom counts are computed as the iterator advances.
     *
     * @throws com.formula.exception.FormulaException if the formula does not parse
     */
    @Override
    public Iterator<ElementCount> iterator() {
        List<Token> tokens = new FormulaTokenizer(formula).tokenize();

        SortedSet<String> symbols = new TreeSet<>();
        for (Token token : tokens) {
            if (token.type() == TokenType.ELEMENT && table.contains(token.text())) {
                symbols.add(token.text());
            }
        }

        FormulaTree tree = new FormulaParser(formula, tokens, maxDepth).parse();
        return new ElementIterator(symbols.iterator(), tree, new AtomCounter(table));
    }

    public Stream<ElementCount> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<ElementCount> toList() {
        return stream().toList();
    }

    private static final class ElementIterator implements Iterator<ElementCount> {

        private final Iterator<String> symbols;
        private final FormulaTree tree;
        private final AtomCounter counter;

        private ElementIterator(Iterator<String> symbols, FormulaTree tree, AtomCounter counter) {
            this.symbols = symbols;
            this.tree = tree;
            this.counter = counter;
        }

        @Override
        public boolean hasNext() {
            return symbols.hasNext();
        }

        @Override
        public ElementCount next() {
            if (!symbols.hasNext()) {
                throw new NoSuchElementException();
            }
            String symbol = symbols.next();
            return new ElementCount(symbol, counter.countAtoms(tree, symbol));
        }
    }
}
