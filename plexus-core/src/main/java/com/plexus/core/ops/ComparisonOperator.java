package com.plexus.core.ops;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum ComparisonOperator {
    EQ("=="),
    NOT_EQ("!="),
    LT("<"),
    LT_E("<="),
    GT(">"),
    GT_E(">=");

    public static final int PRECEDENCE = 1;

    private static final Map<String, ComparisonOperator> BY_SYMBOL = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(ComparisonOperator::symbol, Function.identity())));

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() { return symbol; }

    /** Returns null if {@code symbol} is not a comparison operator. */
    public static ComparisonOperator fromSymbol(String symbol) {
        return symbol == null ? null : BY_SYMBOL.get(symbol);
    }
}
