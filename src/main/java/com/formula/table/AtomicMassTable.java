package com.formula.table;

import com.formula.exception.ConfigurationException;
import com.formula.exception.UnknownSymbolException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable mapping from element symbol to atomic mass (amu).
 * <p>
 * Symbols are case-sensitive: one uppercase letter followed by lowercase letters.
 * The standard table is read once per process from {@value #DEFAULT_PATH};
 * callers needing other data build their own instance with {@link #of(Map)}
 * or {@link AtomicMassTableLoader#load(String)}.
 */
public final class AtomicMassTable {

    public static final String DEFAULT_PATH = "classpath:atomic-masses.yaml";

    private static final Pattern SYMBOL_PATTERN = Pattern.compile("[A-Z][a-z]*");

    private final Map<String, Double> masses;

    private AtomicMassTable(Map<String, Double> masses) {
        this.masses = masses;
    }

    /**
     * Get the bundled standard table (H through Mt).
     */
    public static AtomicMassTable standard() {
        return StandardHolder.INSTANCE;
    }

    /**
     * Create a table from a symbol to mass mapping.
     *
     * @param masses Symbol to mass entries; every mass must be positive
     * @return Immutable table preserving the given iteration order
     * @throws ConfigurationException if a symbol is malformed or a mass is not positive
     */
    public static AtomicMassTable of(Map<String, ? extends Number> masses) {
        if (masses == null || masses.isEmpty()) {
            throw new ConfigurationException("Atomic mass table must contain at least one element");
        }

        Map<String, Double> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Number> entry : masses.entrySet()) {
            String symbol = entry.getKey();
            Number mass = entry.getValue();

            if (symbol == null || !SYMBOL_PATTERN.matcher(symbol).matches()) {
                throw new ConfigurationException("Malformed element symbol in atomic mass table: '" + symbol + "'");
            }
            if (mass == null || !(mass.doubleValue() > 0)) {
                throw new ConfigurationException("Atomic mass of '" + symbol + "' must be positive, got " + mass);
            }
            copy.put(symbol, mass.doubleValue());
        }
        return new AtomicMassTable(Collections.unmodifiableMap(copy));
    }

    /**
     * Check whether a symbol is a key of this table.
     */
    public boolean contains(String symbol) {
        return symbol != null && masses.containsKey(symbol);
    }

    /**
     * Get the mass of an element.
     *
     * @param symbol Element symbol
     * @return Atomic mass in amu
     * @throws UnknownSymbolException if the symbol is not in the table
     */
    public double mass(String symbol) {
        Double mass = symbol == null ? null : masses.get(symbol);
        if (mass == null) {
            throw new UnknownSymbolException(symbol);
        }
        return mass;
    }

    public Optional<Double> find(String symbol) {
        return symbol == null ? Optional.empty() : Optional.ofNullable(masses.get(symbol));
    }

    public Set<String> symbols() {
        return masses.keySet();
    }

    public int size() {
        return masses.size();
    }

    public Map<String, Double> asMap() {
        return masses;
    }

    @Override
    public String toString() {
        return "AtomicMassTable(" + masses.size() + " elements)";
    }

    private static final class StandardHolder {
        private static final AtomicMassTable INSTANCE = AtomicMassTableLoader.load(DEFAULT_PATH);
    }
}
