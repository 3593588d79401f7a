package org.finos.legend.math.ast;

import org.finos.legend.math.error.DivisionByZeroException;
import org.finos.legend.math.number.MathFunctions;
import org.finos.legend.math.number.Rational;

/**
 * An exact fraction literal, normalized on construction (lowest terms, positive denominator).
 */
public record RationalNode(long numerator, long denominator) implements NumericNode {

    public RationalNode {
        if (denominator == 0) {
            throw new DivisionByZeroException();
        }
        long g = MathFunctions.gcd(numerator, denominator);
        if (g > 1) {
            numerator /= g;
            denominator /= g;
        }
        if (denominator < 0) {
            numerator = Math.negateExact(numerator);
            denominator = Math.negateExact(denominator);
        }
    }

    public static RationalNode of(Rational rational) {
        return new RationalNode(rational.numerator(), rational.denominator());
    }

    public Rational toRational() {
        return new Rational(numerator, denominator);
    }

    public double value() {
        return (double) numerator / denominator;
    }

    @Override
    public double doubleValue() {
        return value();
    }

    @Override
    public int rank() {
        return 1;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitRational(this);
    }

    @Override
    public String toString() {
        return numerator + "/" + denominator;
    }
}
