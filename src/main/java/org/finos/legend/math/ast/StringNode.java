package org.finos.legend.math.ast;

import java.util.Objects;

/**
 * Verbatim text, such as the ".99" tail given to ending().
 */
public record StringNode(String value) implements OperandNode {

    public StringNode {
        Objects.requireNonNull(value, "String value cannot be null");
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitString(this);
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
