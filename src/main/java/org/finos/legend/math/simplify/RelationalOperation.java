package org.finos.legend.math.simplify;

import org.finos.legend.math.ast.BooleanNode;
import org.finos.legend.math.ast.InfixNode;
import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.NumericNode;
import org.finos.legend.math.ast.Operator;
import org.finos.legend.math.ast.StringNode;
import org.finos.legend.math.error.UnknownOperatorException;

/**
 * Builds comparisons. Only two literals of the same concrete type are decided at build time;
 * variables and constants stay symbolic since their values are only known to the evaluator.
 */
final class RelationalOperation {

    Node make(Operator operator, Node left, Node right) {
        if (!operator.isRelational()) {
            throw new UnknownOperatorException(operator.symbol());
        }
        if (!isLiteral(left) || left.getClass() != right.getClass()) {
            return InfixNode.of(operator, left, right);
        }
        return BooleanNode.of(operator.holds(compare(left, right)));
    }

    static boolean isLiteral(Node node) {
        return node instanceof NumericNode || node instanceof BooleanNode || node instanceof StringNode;
    }

    private static int compare(Node left, Node right) {
        if (left instanceof NumericNode l) {
            return NumericTower.compare(l, (NumericNode) right);
        }
        if (left instanceof BooleanNode l) {
            return Boolean.compare(l.value(), ((BooleanNode) right).value());
        }
        return ((StringNode) left).value().compareTo(((StringNode) right).value());
    }
}
