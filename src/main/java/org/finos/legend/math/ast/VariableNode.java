package org.finos.legend.math.ast;

import java.util.Objects;

public record VariableNode(String name) implements OperandNode {

    public VariableNode {
        Objects.requireNonNull(name, "Variable name cannot be null");
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
