package org.finos.legend.math.ast;

public record IntegerNode(long value) implements NumericNode {

    public static IntegerNode of(long value) {
        return new IntegerNode(value);
    }

    @Override
    public double doubleValue() {
        return value;
    }

    @Override
    public int rank() {
        return 0;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitInteger(this);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
