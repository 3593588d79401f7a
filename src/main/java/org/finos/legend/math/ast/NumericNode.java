package org.finos.legend.math.ast;

/**
 * The numeric tower of literal operands: Integer, Rational, Float, from least to most general.
 */
public sealed interface NumericNode extends OperandNode permits IntegerNode, RationalNode, FloatNode {

    double doubleValue();

    default boolean isZero() {
        return doubleValue() == 0;
    }

    default boolean isOne() {
        return doubleValue() == 1;
    }

    /**
     * Position in the numeric tower; combining two literals yields the larger rank.
     */
    int rank();
}
