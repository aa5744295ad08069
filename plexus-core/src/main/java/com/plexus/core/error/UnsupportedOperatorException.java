package com.plexus.core.error;

public class UnsupportedOperatorException extends MalformedGraphException {

    private final String symbol;

    public UnsupportedOperatorException(String symbol, String nodeId) {
        super("Operator '" + symbol + "' is not implemented", nodeId, "value");
        this.symbol = symbol;
    }

    public String symbol() { return symbol; }
}
