package org.finos.legend.math.simplify;

import org.finos.legend.math.ast.InfixNode;
import org.finos.legend.math.ast.IntegerNode;
import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.NumericNode;
import org.finos.legend.math.ast.Operator;

final class MultiplicationOperation {

    Node make(Node left, Node right) {
        if (left instanceof NumericNode l && right instanceof NumericNode r) {
            return NumericTower.multiply(l, r);
        }
        if (left instanceof NumericNode l) {
            if (l.isZero()) {
                return IntegerNode.of(0);
            }
            if (l.isOne()) {
                return right;
            }
        }
        if (right instanceof NumericNode r) {
            if (r.isZero()) {
                return IntegerNode.of(0);
            }
            if (r.isOne()) {
                return left;
            }
        }
        return InfixNode.of(Operator.MULTIPLY, left, right);
    }
}
