package org.finos.legend.math.simplify;

import org.finos.legend.math.ast.BooleanNode;
import org.finos.legend.math.ast.InfixNode;
import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.Operator;

final class DisjunctionOperation {

    Node make(Node left, Node right) {
        if (left instanceof BooleanNode l && right instanceof BooleanNode r) {
            return BooleanNode.of(l.value() || r.value());
        }
        return InfixNode.of(Operator.OR, left, right);
    }
}
