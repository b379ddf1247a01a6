package com.formula.exception;

/**
 * Exception thrown when an alphabetic symbol is not a key of the atomic mass table.
 */
public class UnknownSymbolException extends FormulaException {

    private final String symbol;

    public UnknownSymbolException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public UnknownSymbolException(String symbol) {
        this(symbol, "Not an atomic symbol: '" + symbol + "'");
    }

    public String getSymbol() {
        return symbol;
    }
}
