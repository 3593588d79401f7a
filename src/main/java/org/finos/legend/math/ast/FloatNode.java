package org.finos.legend.math.ast;

public record FloatNode(double value) implements NumericNode {

    public static FloatNode of(double value) {
        return new FloatNode(value);
    }

    @Override
    public double doubleValue() {
        return value;
    }

    @Override
    public int rank() {
        return 2;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitFloat(this);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
