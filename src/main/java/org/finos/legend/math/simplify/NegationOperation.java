package org.finos.legend.math.simplify;

import org.finos.legend.math.ast.BooleanNode;
import org.finos.legend.math.ast.InfixNode;
import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.Operator;

final class NegationOperation {

    Node make(Node operand) {
        if (operand instanceof BooleanNode b) {
            return BooleanNode.of(!b.value());
        }
        return InfixNode.unary(Operator.NOT, operand);
    }
}
