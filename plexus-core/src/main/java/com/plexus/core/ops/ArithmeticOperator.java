package com.plexus.core.ops;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum ArithmeticOperator {
    ADD("+", 2),
    SUB("-", 2),
    MUL("*", 3),
    DIV("/", 3);

    private static final Map<String, ArithmeticOperator> BY_SYMBOL = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(ArithmeticOperator::symbol, Function.identity())));

    private final String symbol;
    private final int precedence;

    ArithmeticOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() { return symbol; }

    /** Binding strength used when unparsing; higher binds tighter. Comparisons sit below all of these. */
    public int precedence() { return precedence; }

    /** Returns null if {@code symbol} is not an arithmetic operator. */
    public static ArithmeticOperator fromSymbol(String symbol) {
        return symbol == null ? null : BY_SYMBOL.get(symbol);
    }
}
