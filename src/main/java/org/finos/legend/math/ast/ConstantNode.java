package org.finos.legend.math.ast;

import java.util.Objects;

/**
 * A named constant such as pi, e, i, NAN or INF; its value is decided by the evaluator.
 */
public record ConstantNode(String name) implements OperandNode {

    public ConstantNode {
        Objects.requireNonNull(name, "Constant name cannot be null");
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
