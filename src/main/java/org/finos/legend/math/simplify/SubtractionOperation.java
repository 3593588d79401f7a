package org.finos.legend.math.simplify;

import org.finos.legend.math.ast.InfixNode;
import org.finos.legend.math.ast.IntegerNode;
import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.NumericNode;
import org.finos.legend.math.ast.Operator;

/**
 * Builds differences and negations.
 */
final class SubtractionOperation {

    Node make(Node left, Node right) {
        if (left instanceof NumericNode l && right instanceof NumericNode r) {
            return NumericTower.subtract(l, r);
        }
        if (right instanceof NumericNode r && r.isZero()) {
            return left;
        }
        if (left.equals(right)) {
            return IntegerNode.of(0);
        }
        return InfixNode.of(Operator.SUBTRACT, left, right);
    }

    Node negate(Node operand) {
        if (operand instanceof NumericNode n) {
            return NumericTower.negate(n);
        }
        // -(-x) is x
        if (operand instanceof InfixNode inner && inner.operator() == Operator.SUBTRACT && inner.isUnary()) {
            return inner.left();
        }
        return InfixNode.unary(Operator.SUBTRACT, operand);
    }
}
