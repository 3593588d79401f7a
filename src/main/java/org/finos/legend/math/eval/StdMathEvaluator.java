package org.finos.legend.math.eval;

import org.finos.legend.math.ast.BooleanNode;
import org.finos.legend.math.ast.ConstantNode;
import org.finos.legend.math.ast.FloatNode;
import org.finos.legend.math.ast.FunctionNode;
import org.finos.legend.math.ast.InfixNode;
import org.finos.legend.math.ast.IntegerNode;
import org.finos.legend.math.ast.NodeVisitor;
import org.finos.legend.math.ast.Operator;
import org.finos.legend.math.ast.RationalNode;
import org.finos.legend.math.ast.StringNode;
import org.finos.legend.math.ast.TernaryNode;
import org.finos.legend.math.ast.VariableNode;
import org.finos.legend.math.error.DivisionByZeroException;
import org.finos.legend.math.error.ExponentialException;
import org.finos.legend.math.error.NullOperandException;
import org.finos.legend.math.error.SyntaxErrorException;
import org.finos.legend.math.error.UnexpectedValueException;
import org.finos.legend.math.error.UnknownConstantException;
import org.finos.legend.math.error.UnknownOperatorException;
import org.finos.legend.math.error.UnknownVariableException;

import java.util.Map;

/**
 * Evaluates a tree to a double. Booleans, comparisons and conditionals are not part of this domain.
 */
public class StdMathEvaluator implements NodeVisitor<Double> {

    private final Map<String, ? extends Number> bindings;

    public StdMathEvaluator() {
        this(Map.of());
    }

    public StdMathEvaluator(Map<String, ? extends Number> bindings) {
        this.bindings = bindings;
    }

    @Override
    public Double visitInteger(IntegerNode node) {
        return (double) node.value();
    }

    @Override
    public Double visitRational(RationalNode node) {
        return node.value();
    }

    @Override
    public Double visitFloat(FloatNode node) {
        return node.value();
    }

    @Override
    public Double visitBoolean(BooleanNode node) {
        throw new SyntaxErrorException("Boolean value " + node + " in an arithmetic expression");
    }

    @Override
    public Double visitVariable(VariableNode node) {
        Number value = bindings.get(node.name());
        if (value == null) {
            throw new UnknownVariableException(node.name());
        }
        return value.doubleValue();
    }

    @Override
    public Double visitConstant(ConstantNode node) {
        return switch (node.name()) {
            case "pi" -> Math.PI;
            case "e" -> Math.E;
            case "NAN" -> Double.NaN;
            case "INF" -> Double.POSITIVE_INFINITY;
            default -> throw new UnknownConstantException(node.name());
        };
    }

    @Override
    public Double visitString(StringNode node) {
        try {
            return Double.parseDouble(node.value());
        } catch (NumberFormatException e) {
            throw new UnexpectedValueException("Not a number: '" + node.value() + "'");
        }
    }

    @Override
    public Double visitInfix(InfixNode node) {
        Operator operator = node.operator();
        if (node.left() == null) {
            throw new NullOperandException(operator.symbol());
        }
        double left = node.left().accept(this);
        if (node.isUnary()) {
            if (operator != Operator.SUBTRACT) {
                throw new NullOperandException(operator.symbol());
            }
            return -left;
        }
        double right = node.right().accept(this);
        return arithmetic(operator, left, right);
    }

    static double arithmetic(Operator operator, double left, double right) {
        return switch (operator) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> {
                if (right == 0) {
                    throw new DivisionByZeroException();
                }
                yield left / right;
            }
            case POWER -> {
                if (left == 0 && right == 0) {
                    throw new ExponentialException();
                }
                yield Math.pow(left, right);
            }
            default -> throw new UnknownOperatorException(operator.symbol());
        };
    }

    @Override
    public Double visitTernary(TernaryNode node) {
        throw new SyntaxErrorException("Conditional expressions are not supported in arithmetic");
    }

    @Override
    public Double visitFunction(FunctionNode node) {
        return RealFunctions.apply(node.name(), node.argument().accept(this));
    }
}
