package org.finos.legend.math.ast;

import java.util.Objects;

/**
 * A conditional expression. Evaluators must only evaluate the branch the condition selects.
 */
public record TernaryNode(Node condition, Node thenBranch, Node elseBranch) implements Node {

    public TernaryNode {
        Objects.requireNonNull(condition, "Condition cannot be null");
        Objects.requireNonNull(thenBranch, "Then branch cannot be null");
        Objects.requireNonNull(elseBranch, "Else branch cannot be null");
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitTernary(this);
    }

    @Override
    public String toString() {
        return "IF " + condition + " THEN " + thenBranch + " ELSE " + elseBranch;
    }
}
