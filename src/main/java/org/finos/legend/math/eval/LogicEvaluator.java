package org.finos.legend.math.eval;

import org.finos.legend.math.ast.BooleanNode;
import org.finos.legend.math.ast.ConstantNode;
import org.finos.legend.math.ast.FloatNode;
import org.finos.legend.math.ast.FunctionNode;
import org.finos.legend.math.ast.InfixNode;
import org.finos.legend.math.ast.IntegerNode;
import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.NodeVisitor;
import org.finos.legend.math.ast.Operator;
import org.finos.legend.math.ast.RationalNode;
import org.finos.legend.math.ast.StringNode;
import org.finos.legend.math.ast.TernaryNode;
import org.finos.legend.math.ast.VariableNode;
import org.finos.legend.math.error.NullOperandException;
import org.finos.legend.math.error.UnknownConstantException;
import org.finos.legend.math.error.UnknownOperatorException;
import org.finos.legend.math.error.UnknownVariableException;

import java.util.Map;

/**
 * Evaluates arithmetic, comparisons, boolean connectives and conditionals.
 *
 * Results are Double for arithmetic and Boolean for logical operators. A conditional evaluates its
 * condition and then only the selected branch; AND and OR stop once the result is known.
 */
public class LogicEvaluator implements NodeVisitor<Object> {

    private final Map<String, ?> bindings;

    public LogicEvaluator() {
        this(Map.of());
    }

    public LogicEvaluator(Map<String, ?> bindings) {
        this.bindings = bindings;
    }

    protected Object evaluate(Node node) {
        return node.accept(this);
    }

    protected double number(Node node) {
        return LogicValues.toNumber(evaluate(node));
    }

    @Override
    public Object visitInteger(IntegerNode node) {
        return (double) node.value();
    }

    @Override
    public Object visitRational(RationalNode node) {
        return node.value();
    }

    @Override
    public Object visitFloat(FloatNode node) {
        return node.value();
    }

    @Override
    public Object visitBoolean(BooleanNode node) {
        return node.value();
    }

    @Override
    public Object visitVariable(VariableNode node) {
        Object value = bindings.get(node.name());
        if (value == null) {
            throw new UnknownVariableException(node.name());
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return value;
    }

    @Override
    public Object visitConstant(ConstantNode node) {
        return switch (node.name()) {
            case "pi" -> Math.PI;
            case "e" -> Math.E;
            case "NAN" -> Double.NaN;
            case "INF" -> Double.POSITIVE_INFINITY;
            default -> throw new UnknownConstantException(node.name());
        };
    }

    @Override
    public Object visitString(StringNode node) {
        return node.value();
    }

    @Override
    public Object visitInfix(InfixNode node) {
        Operator operator = node.operator();
        if (node.left() == null) {
            throw new NullOperandException(operator.symbol());
        }
        if (node.isUnary()) {
            if (operator != Operator.SUBTRACT) {
                throw new NullOperandException(operator.symbol());
            }
            return -number(node.left());
        }
        return StdMathEvaluator.arithmetic(operator, number(node.left()), number(node.right()));
    }

    @Override
    public Object visitLogicalInfix(InfixNode node) {
        Operator operator = node.operator();
        if (node.left() == null) {
            throw new NullOperandException(operator.symbol());
        }
        if (operator == Operator.NOT) {
            if (!node.isUnary()) {
                throw new UnknownOperatorException(operator.symbol());
            }
            return !LogicValues.isTruthy(evaluate(node.left()));
        }
        if (node.isUnary()) {
            throw new NullOperandException(operator.symbol());
        }
        return switch (operator) {
            case AND -> LogicValues.isTruthy(evaluate(node.left())) && LogicValues.isTruthy(evaluate(node.right()));
            case OR -> LogicValues.isTruthy(evaluate(node.left())) || LogicValues.isTruthy(evaluate(node.right()));
            default -> operator.holds(LogicValues.compare(evaluate(node.left()), evaluate(node.right())));
        };
    }

    @Override
    public Object visitTernary(TernaryNode node) {
        if (LogicValues.isTruthy(evaluate(node.condition()))) {
            return evaluate(node.thenBranch());
        }
        return evaluate(node.elseBranch());
    }

    @Override
    public Object visitFunction(FunctionNode node) {
        return RealFunctions.apply(node.name(), number(node.argument()));
    }
}
