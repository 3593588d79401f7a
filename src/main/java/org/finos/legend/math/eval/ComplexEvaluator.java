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
import org.finos.legend.math.error.LogarithmOfZeroException;
import org.finos.legend.math.error.NullOperandException;
import org.finos.legend.math.error.SyntaxErrorException;
import org.finos.legend.math.error.UnexpectedValueException;
import org.finos.legend.math.error.UnknownConstantException;
import org.finos.legend.math.error.UnknownFunctionException;
import org.finos.legend.math.error.UnknownOperatorException;
import org.finos.legend.math.error.UnknownVariableException;
import org.finos.legend.math.number.Complex;

import java.util.Map;

/**
 * Evaluates a tree over the complex numbers. Real literals and bindings are promoted.
 */
public class ComplexEvaluator implements NodeVisitor<Complex> {

    private static final double DEGREES = Math.PI / 180;

    private final Map<String, ?> bindings;

    public ComplexEvaluator() {
        this(Map.of());
    }

    /**
     * @param bindings Values as Complex, any Number, or strings such as "3+4i"
     */
    public ComplexEvaluator(Map<String, ?> bindings) {
        this.bindings = bindings;
    }

    @Override
    public Complex visitInteger(IntegerNode node) {
        return Complex.real(node.value());
    }

    @Override
    public Complex visitRational(RationalNode node) {
        return Complex.real(node.value());
    }

    @Override
    public Complex visitFloat(FloatNode node) {
        return Complex.real(node.value());
    }

    @Override
    public Complex visitBoolean(BooleanNode node) {
        throw new SyntaxErrorException("Boolean value " + node + " in a complex expression");
    }

    @Override
    public Complex visitVariable(VariableNode node) {
        Object value = bindings.get(node.name());
        if (value == null) {
            throw new UnknownVariableException(node.name());
        }
        if (value instanceof Complex c) {
            return c;
        }
        if (value instanceof Number n) {
            return Complex.real(n.doubleValue());
        }
        if (value instanceof String s) {
            return Complex.parse(s);
        }
        throw new UnexpectedValueException("Value of '" + node.name() + "' is not a complex number: " + value);
    }

    @Override
    public Complex visitConstant(ConstantNode node) {
        return switch (node.name()) {
            case "pi" -> Complex.real(Math.PI);
            case "e" -> Complex.real(Math.E);
            case "i" -> Complex.I;
            case "NAN" -> Complex.real(Double.NaN);
            case "INF" -> Complex.real(Double.POSITIVE_INFINITY);
            default -> throw new UnknownConstantException(node.name());
        };
    }

    @Override
    public Complex visitString(StringNode node) {
        return Complex.parse(node.value());
    }

    @Override
    public Complex visitInfix(InfixNode node) {
        Operator operator = node.operator();
        if (node.left() == null) {
            throw new NullOperandException(operator.symbol());
        }
        Complex left = node.left().accept(this);
        if (node.isUnary()) {
            if (operator != Operator.SUBTRACT) {
                throw new NullOperandException(operator.symbol());
            }
            return left.negate();
        }
        Complex right = node.right().accept(this);
        return switch (operator) {
            case ADD -> left.add(right);
            case SUBTRACT -> left.subtract(right);
            case MULTIPLY -> left.multiply(right);
            case DIVIDE -> left.divide(right);
            case POWER -> left.pow(right);
            default -> throw new UnknownOperatorException(operator.symbol());
        };
    }

    @Override
    public Complex visitTernary(TernaryNode node) {
        throw new SyntaxErrorException("Conditional expressions are not supported in complex arithmetic");
    }

    @Override
    public Complex visitFunction(FunctionNode node) {
        String name = node.name();
        Complex z = node.argument().accept(this);
        return switch (name) {
            case "sin" -> z.sin();
            case "cos" -> z.cos();
            case "tan" -> z.tan();
            case "cot" -> z.cot();
            case "sind" -> z.multiply(DEGREES).sin();
            case "cosd" -> z.multiply(DEGREES).cos();
            case "tand" -> z.multiply(DEGREES).tan();
            case "cotd" -> z.multiply(DEGREES).cot();
            case "arcsin" -> z.arcsin();
            case "arccos" -> z.arccos();
            case "arctan" -> z.arctan();
            case "arccot" -> z.arccot();
            case "sinh" -> z.sinh();
            case "cosh" -> z.cosh();
            case "tanh" -> z.tanh();
            case "coth" -> z.coth();
            case "arsinh" -> z.arsinh();
            case "arcosh" -> z.arcosh();
            case "artanh" -> z.artanh();
            case "arcoth" -> z.arcoth();
            case "exp" -> z.exp();
            case "log" -> z.log();
            case "ln" -> Complex.real(Math.log(positiveReal(name, z)));
            case "lg" -> z.log().multiply(1 / Math.log(10));
            case "sqrt" -> z.sqrt();
            case "abs" -> Complex.real(z.abs());
            case "arg" -> Complex.real(z.arg());
            case "re" -> Complex.real(z.re());
            case "im" -> Complex.real(z.im());
            case "conj" -> z.conj();
            case "sgn" -> z.isZero() ? Complex.ZERO : z.multiply(1 / z.abs());
            case "!", "!!", "round", "floor", "ceil" -> Complex.real(RealFunctions.apply(name, real(name, z)));
            default -> throw new UnknownFunctionException(name);
        };
    }

    private static double real(String name, Complex z) {
        if (!z.isReal()) {
            throw new UnexpectedValueException("'" + name + "' needs a real argument, got " + z);
        }
        return z.re();
    }

    private static double positiveReal(String name, Complex z) {
        if (z.isZero()) {
            throw new LogarithmOfZeroException();
        }
        double x = real(name, z);
        if (x < 0) {
            throw new UnexpectedValueException("'" + name + "' needs a positive real argument, got " + z);
        }
        return x;
    }
}
