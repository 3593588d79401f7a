package org.finos.legend.math.ast;

import java.util.Objects;

/**
 * A binary operation, or a prefix operation (unary minus, NOT) when {@code right} is null.
 *
 * Relational and boolean operators are dispatched to {@link NodeVisitor#visitLogicalInfix},
 * all others to {@link NodeVisitor#visitInfix}.
 *
 * @param operator The operator
 * @param left     The left operand, or the only operand of a prefix operation
 * @param right    The right operand, null for prefix operations
 */
public record InfixNode(Operator operator, Node left, Node right) implements Node {

    public InfixNode {
        Objects.requireNonNull(operator, "Operator cannot be null");
    }

    public static InfixNode of(Operator operator, Node left, Node right) {
        return new InfixNode(operator, left, right);
    }

    public static InfixNode unary(Operator operator, Node operand) {
        return new InfixNode(operator, operand, null);
    }

    public boolean isUnary() {
        return right == null;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        if (operator.isLogical()) {
            return visitor.visitLogicalInfix(this);
        }
        return visitor.visitInfix(this);
    }

    @Override
    public String toString() {
        if (isUnary()) {
            return "(" + operator.symbol() + " " + left + ")";
        }
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
