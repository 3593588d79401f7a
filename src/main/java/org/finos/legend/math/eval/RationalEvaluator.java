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
import org.finos.legend.math.error.ExponentialException;
import org.finos.legend.math.error.NullOperandException;
import org.finos.legend.math.error.SyntaxErrorException;
import org.finos.legend.math.error.UnexpectedValueException;
import org.finos.legend.math.error.UnknownConstantException;
import org.finos.legend.math.error.UnknownFunctionException;
import org.finos.legend.math.error.UnknownOperatorException;
import org.finos.legend.math.error.UnknownVariableException;
import org.finos.legend.math.number.MathFunctions;
import org.finos.legend.math.number.Rational;

import java.math.BigInteger;
import java.util.Map;

/**
 * Evaluates a tree in exact rational arithmetic.
 *
 * Anything without an exact rational value is rejected with UnexpectedValueException: floating
 * point literals, pi and e, transcendental functions, and roots that are not exact.
 */
public class RationalEvaluator implements NodeVisitor<Rational> {

    private final Map<String, ?> bindings;

    public RationalEvaluator() {
        this(Map.of());
    }

    /**
     * @param bindings Values as Rational, integral numbers or "p/q" strings
     */
    public RationalEvaluator(Map<String, ?> bindings) {
        this.bindings = bindings;
    }

    @Override
    public Rational visitInteger(IntegerNode node) {
        return Rational.of(node.value());
    }

    @Override
    public Rational visitRational(RationalNode node) {
        return node.toRational();
    }

    @Override
    public Rational visitFloat(FloatNode node) {
        throw new UnexpectedValueException("Floating point value " + node.value() + " in rational arithmetic");
    }

    @Override
    public Rational visitBoolean(BooleanNode node) {
        throw new UnexpectedValueException("Boolean value " + node + " in rational arithmetic");
    }

    @Override
    public Rational visitVariable(VariableNode node) {
        Object value = bindings.get(node.name());
        if (value == null) {
            throw new UnknownVariableException(node.name());
        }
        return toRational(node.name(), value);
    }

    private static Rational toRational(String name, Object value) {
        if (value instanceof Rational r) {
            return r;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return Rational.of(((Number) value).longValue());
        }
        if (value instanceof BigInteger b) {
            try {
                return Rational.of(b.longValueExact());
            } catch (ArithmeticException e) {
                throw new UnexpectedValueException("Value of '" + name + "' does not fit a rational number");
            }
        }
        if (value instanceof Number n && MathFunctions.isIntegral(n.doubleValue())) {
            return Rational.of((long) n.doubleValue());
        }
        if (value instanceof String s) {
            try {
                return Rational.parse(s);
            } catch (SyntaxErrorException e) {
                throw new UnexpectedValueException("Value of '" + name + "' is not a rational number: '" + s + "'");
            }
        }
        throw new UnexpectedValueException("Value of '" + name + "' is not a rational number: " + value);
    }

    @Override
    public Rational visitConstant(ConstantNode node) {
        switch (node.name()) {
            case "pi", "e", "NAN", "INF" ->
                    throw new UnexpectedValueException("Constant " + node.name() + " is not rational");
            default -> throw new UnknownConstantException(node.name());
        }
    }

    @Override
    public Rational visitString(StringNode node) {
        return Rational.parse(node.value());
    }

    @Override
    public Rational visitInfix(InfixNode node) {
        Operator operator = node.operator();
        if (node.left() == null) {
            throw new NullOperandException(operator.symbol());
        }
        Rational left = node.left().accept(this);
        try {
            if (node.isUnary()) {
                if (operator != Operator.SUBTRACT) {
                    throw new NullOperandException(operator.symbol());
                }
                return left.negate();
            }
            Rational right = node.right().accept(this);
            return switch (operator) {
                case ADD -> left.add(right);
                case SUBTRACT -> left.subtract(right);
                case MULTIPLY -> left.multiply(right);
                case DIVIDE -> left.divide(right);
                case POWER -> power(left, right);
                default -> throw new UnknownOperatorException(operator.symbol());
            };
        } catch (ArithmeticException overflow) {
            throw new UnexpectedValueException("Rational overflow in '" + operator.symbol() + "'");
        }
    }

    /**
     * base^(p/q), defined exactly as the q-th root of base^p.
     */
    static Rational power(Rational base, Rational exponent) {
        if (base.isZero() && exponent.isZero()) {
            throw new ExponentialException();
        }
        Rational raised = base.pow(exponent.numerator());
        return root(raised, exponent.denominator());
    }

    static Rational root(Rational value, long degree) {
        if (degree == 1) {
            return value;
        }
        if (value.signum() < 0 && degree % 2 == 0) {
            throw new UnexpectedValueException("Even root of negative number " + value);
        }
        long numerator = integerRoot(Math.abs(value.numerator()), degree);
        long denominator = integerRoot(value.denominator(), degree);
        if (numerator < 0 || denominator < 0) {
            throw new UnexpectedValueException("Root of degree " + degree + " of " + value + " is not rational");
        }
        return new Rational(value.signum() < 0 ? -numerator : numerator, denominator);
    }

    // exact k-th root of a non-negative long, or -1 if there is none
    private static long integerRoot(long n, long k) {
        if (n < 2) {
            return n;
        }
        long guess = Math.round(Math.pow(n, 1.0 / k));
        for (long candidate = Math.max(0, guess - 1); candidate <= guess + 1; candidate++) {
            try {
                long p = 1;
                for (long i = 0; i < k; i++) {
                    p = Math.multiplyExact(p, candidate);
                }
                if (p == n) {
                    return candidate;
                }
            } catch (ArithmeticException overflow) {
                return -1;
            }
        }
        return -1;
    }

    @Override
    public Rational visitTernary(TernaryNode node) {
        throw new SyntaxErrorException("Conditional expressions are not supported in rational arithmetic");
    }

    @Override
    public Rational visitFunction(FunctionNode node) {
        String name = node.name();
        if (!RealFunctions.isKnown(name)) {
            throw new UnknownFunctionException(name);
        }
        Rational x = node.argument().accept(this);
        try {
            return switch (name) {
                case "abs" -> x.abs();
                case "sgn" -> Rational.of(x.signum());
                case "sqrt" -> root(x, 2);
                case "!" -> Rational.of(MathFunctions.factorial(natural(name, x)));
                case "!!" -> Rational.of(MathFunctions.semiFactorial(natural(name, x)));
                default -> throw new UnexpectedValueException("Function '" + name + "' has no exact rational value");
            };
        } catch (ArithmeticException overflow) {
            throw new UnexpectedValueException("Rational overflow in '" + name + "'");
        }
    }

    private static long natural(String name, Rational x) {
        if (!x.isInteger() || x.signum() < 0) {
            throw new UnexpectedValueException("'" + name + "' needs a natural number, got " + x);
        }
        return x.numerator();
    }
}
