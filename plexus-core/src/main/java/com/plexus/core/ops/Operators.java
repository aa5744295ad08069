package com.plexus.core.ops;

import com.plexus.core.error.UnsupportedOperatorException;

/**
 * Classifies a {@code binary_op} symbol. The graph keeps arithmetic and comparison in one
 * node kind, but they compile to different expression shapes.
 */
public final class Operators {

    public enum Family { ARITHMETIC, COMPARISON }

    private Operators() {}

    /**
     * @param nodeId owning node, reported on failure
     * @throws UnsupportedOperatorException if the symbol is in neither table
     */
    public static Family classify(String symbol, String nodeId) {
        if (ArithmeticOperator.fromSymbol(symbol) != null) return Family.ARITHMETIC;
        if (ComparisonOperator.fromSymbol(symbol) != null) return Family.COMPARISON;
        throw new UnsupportedOperatorException(symbol, nodeId);
    }
}
