package org.finos.legend.math.simplify;

import org.finos.legend.math.ast.FloatNode;
import org.finos.legend.math.ast.IntegerNode;
import org.finos.legend.math.ast.NumericNode;
import org.finos.legend.math.ast.RationalNode;
import org.finos.legend.math.number.Rational;

import java.util.function.BinaryOperator;
import java.util.function.DoubleBinaryOperator;
import java.util.function.LongBinaryOperator;

/**
 * Arithmetic on literal nodes in the least general type covering both operands.
 * Integer and Rational overflow falls back to Float.
 */
final class NumericTower {

    private NumericTower() {
    }

    static int rank(NumericNode left, NumericNode right) {
        return Math.max(left.rank(), right.rank());
    }

    static Rational toRational(NumericNode node) {
        if (node instanceof IntegerNode i) {
            return Rational.of(i.value());
        }
        if (node instanceof RationalNode r) {
            return r.toRational();
        }
        throw new IllegalArgumentException("Not an exact number: " + node);
    }

    static NumericNode combine(NumericNode left, NumericNode right,
                               LongBinaryOperator integer,
                               BinaryOperator<Rational> rational,
                               DoubleBinaryOperator real) {
        int rank = rank(left, right);
        try {
            if (rank == 0) {
                return IntegerNode.of(integer.applyAsLong(((IntegerNode) left).value(), ((IntegerNode) right).value()));
            }
            if (rank == 1) {
                return RationalNode.of(rational.apply(toRational(left), toRational(right)));
            }
        } catch (ArithmeticException overflow) {
            // promoted to Float below
        }
        return FloatNode.of(real.applyAsDouble(left.doubleValue(), right.doubleValue()));
    }

    static NumericNode add(NumericNode left, NumericNode right) {
        return combine(left, right, Math::addExact, Rational::add, Double::sum);
    }

    static NumericNode subtract(NumericNode left, NumericNode right) {
        return combine(left, right, Math::subtractExact, Rational::subtract, (a, b) -> a - b);
    }

    static NumericNode multiply(NumericNode left, NumericNode right) {
        return combine(left, right, Math::multiplyExact, Rational::multiply, (a, b) -> a * b);
    }

    /**
     * Exact operands divide into a RationalNode; callers rule out a zero divisor first.
     */
    static NumericNode divide(NumericNode left, NumericNode right) {
        if (rank(left, right) < 2) {
            try {
                return RationalNode.of(toRational(left).divide(toRational(right)));
            } catch (ArithmeticException overflow) {
                // promoted to Float below
            }
        }
        return FloatNode.of(left.doubleValue() / right.doubleValue());
    }

    static NumericNode negate(NumericNode operand) {
        try {
            if (operand instanceof IntegerNode i) {
                return IntegerNode.of(Math.negateExact(i.value()));
            }
            if (operand instanceof RationalNode r) {
                return new RationalNode(Math.negateExact(r.numerator()), r.denominator());
            }
        } catch (ArithmeticException overflow) {
            // promoted to Float below
        }
        return FloatNode.of(-operand.doubleValue());
    }

    static int compare(NumericNode left, NumericNode right) {
        if (rank(left, right) < 2) {
            try {
                return toRational(left).compareTo(toRational(right));
            } catch (ArithmeticException overflow) {
                // compared as doubles below
            }
        }
        double a = left.doubleValue();
        double b = right.doubleValue();
        return a == b ? 0 : Double.compare(a, b);
    }
}
