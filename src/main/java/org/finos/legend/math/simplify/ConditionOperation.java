package org.finos.legend.math.simplify;

import org.finos.legend.math.ast.BooleanNode;
import org.finos.legend.math.ast.InfixNode;
import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.NumericNode;
import org.finos.legend.math.ast.TernaryNode;

/**
 * Builds conditionals, selecting a branch right away when the condition is already known.
 */
final class ConditionOperation {

    private final RelationalOperation relation;

    ConditionOperation(RelationalOperation relation) {
        this.relation = relation;
    }

    Node make(Node condition, Node thenBranch, Node elseBranch) {
        Node decided = condition;
        if (condition instanceof InfixNode infix && infix.operator().isRelational() && !infix.isUnary()) {
            decided = relation.make(infix.operator(), infix.left(), infix.right());
        }
        if (decided instanceof BooleanNode b) {
            return b.value() ? thenBranch : elseBranch;
        }
        if (decided instanceof NumericNode n) {
            return n.isZero() ? elseBranch : thenBranch;
        }
        return new TernaryNode(condition, thenBranch, elseBranch);
    }
}
