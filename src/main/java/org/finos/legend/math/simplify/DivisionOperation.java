package org.finos.legend.math.simplify;

import org.finos.legend.math.ast.InfixNode;
import org.finos.legend.math.ast.IntegerNode;
import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.NumericNode;
import org.finos.legend.math.ast.Operator;
import org.finos.legend.math.error.DivisionByZeroException;

/**
 * Builds quotients. A literal zero divisor is rejected at build time, 0/0 included.
 */
final class DivisionOperation {

    Node make(Node left, Node right) {
        if (right instanceof NumericNode r && r.isZero()) {
            throw new DivisionByZeroException();
        }
        if (left instanceof NumericNode l && right instanceof NumericNode r) {
            return NumericTower.divide(l, r);
        }
        if (left instanceof NumericNode l && l.isZero()) {
            return IntegerNode.of(0);
        }
        if (right instanceof NumericNode r && r.isOne()) {
            return left;
        }
        if (left.equals(right)) {
            return IntegerNode.of(1);
        }
        return InfixNode.of(Operator.DIVIDE, left, right);
    }
}
