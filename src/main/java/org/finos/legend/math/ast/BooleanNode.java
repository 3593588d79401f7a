package org.finos.legend.math.ast;

public record BooleanNode(boolean value) implements OperandNode {

    public static final BooleanNode TRUE = new BooleanNode(true);
    public static final BooleanNode FALSE = new BooleanNode(false);

    public static BooleanNode of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitBoolean(this);
    }

    @Override
    public String toString() {
        return value ? "TRUE" : "FALSE";
    }
}
