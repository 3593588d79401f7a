package org.finos.legend.math.simplify;

import org.finos.legend.math.ast.FloatNode;
import org.finos.legend.math.ast.InfixNode;
import org.finos.legend.math.ast.IntegerNode;
import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.NumericNode;
import org.finos.legend.math.ast.Operator;
import org.finos.legend.math.ast.RationalNode;
import org.finos.legend.math.error.ExponentialException;
import org.finos.legend.math.number.Rational;

/**
 * Builds powers, folding literals exactly where the result stays exact.
 */
final class ExponentiationOperation {

    private static final long MAX_EXACT_EXPONENT = 62;

    private final MultiplicationOperation multiplication;

    ExponentiationOperation(MultiplicationOperation multiplication) {
        this.multiplication = multiplication;
    }

    Node make(Node base, Node exponent) {
        if (base instanceof NumericNode b && exponent instanceof NumericNode e) {
            if (b.isZero() && e.isZero()) {
                throw new ExponentialException();
            }
        }
        if (exponent instanceof NumericNode e) {
            if (e.isZero()) {
                return IntegerNode.of(1);
            }
            if (e.isOne()) {
                return base;
            }
        }
        if (base instanceof NumericNode b && exponent instanceof NumericNode e) {
            Node folded = fold(b, e);
            if (folded != null) {
                return folded;
            }
        }
        // (x^a)^b is x^(a*b)
        if (!(exponent instanceof NumericNode)
                && base instanceof InfixNode inner && inner.operator() == Operator.POWER) {
            return InfixNode.of(Operator.POWER, inner.left(), multiplication.make(inner.right(), exponent));
        }
        return InfixNode.of(Operator.POWER, base, exponent);
    }

    /**
     * @return the folded literal, or null when the power has to stay unreduced
     */
    private Node fold(NumericNode base, NumericNode exponent) {
        if (base instanceof FloatNode || exponent instanceof FloatNode) {
            return real(base, exponent);
        }
        Rational e = NumericTower.toRational(exponent);
        if (e.isInteger()) {
            long n = e.numerator();
            if (base instanceof IntegerNode b) {
                return integerPower(b.value(), n);
            }
            try {
                return RationalNode.of(((RationalNode) base).toRational().pow(n));
            } catch (ArithmeticException overflow) {
                return FloatNode.of(Math.pow(base.doubleValue(), n));
            }
        }
        return fractionalPower(NumericTower.toRational(base), e);
    }

    private static Node integerPower(long base, long exponent) {
        if (exponent < 0) {
            return null;
        }
        if (exponent > MAX_EXACT_EXPONENT) {
            return FloatNode.of(Math.pow(base, exponent));
        }
        try {
            long result = 1;
            for (long k = 0; k < exponent; k++) {
                result = Math.multiplyExact(result, base);
            }
            return IntegerNode.of(result);
        } catch (ArithmeticException overflow) {
            return FloatNode.of(Math.pow(base, exponent));
        }
    }

    // b^(p/q) is kept exact only if the approximated root r satisfies r^q == b^p
    private static Node fractionalPower(Rational base, Rational exponent) {
        double value = Math.pow(base.doubleValue(), exponent.doubleValue());
        if (Double.isNaN(value)) {
            return null;
        }
        try {
            Rational candidate = Rational.fromDouble(value);
            Rational lhs = candidate.pow(exponent.denominator());
            Rational rhs = base.pow(exponent.numerator());
            if (lhs.equals(rhs)) {
                return RationalNode.of(candidate);
            }
        } catch (ArithmeticException overflow) {
            // not representable exactly
        }
        return FloatNode.of(value);
    }

    private static Node real(NumericNode base, NumericNode exponent) {
        double value = Math.pow(base.doubleValue(), exponent.doubleValue());
        return Double.isNaN(value) ? null : FloatNode.of(value);
    }
}
