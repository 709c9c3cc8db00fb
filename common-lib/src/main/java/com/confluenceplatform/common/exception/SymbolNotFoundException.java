package com.confluenceplatform.common.exception;

public class SymbolNotFoundException extends RuntimeException {
    private final String symbol;

    public SymbolNotFoundException(String symbol) {
        super("Symbol " + symbol + " is not tracked");
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
