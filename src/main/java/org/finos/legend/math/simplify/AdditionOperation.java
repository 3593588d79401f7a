package org.finos.legend.math.simplify;

import org.finos.legend.math.ast.InfixNode;
import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.NumericNode;
import org.finos.legend.math.ast.Operator;

/**
 * Builds sums: 0 + x and x + 0 reduce to x, two literals are added.
 */
final class AdditionOperation {

    Node make(Node left, Node right) {
        if (left instanceof NumericNode l && right instanceof NumericNode r) {
            return NumericTower.add(l, r);
        }
        if (left instanceof NumericNode l && l.isZero()) {
            return right;
        }
        if (right instanceof NumericNode r && r.isZero()) {
            return left;
        }
        return InfixNode.of(Operator.ADD, left, right);
    }
}
