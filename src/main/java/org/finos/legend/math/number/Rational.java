package org.finos.legend.math.number;

import org.finos.legend.math.error.DivisionByZeroException;
import org.finos.legend.math.error.SyntaxErrorException;

/**
 * An exact fraction of two longs, always in lowest terms with a positive denominator.
 *
 * Arithmetic uses exact long operations and throws {@link ArithmeticException} on overflow.
 *
 * @param numerator   The numerator, carrying the sign
 * @param denominator The denominator, strictly positive after normalization
 */
public record Rational(long numerator, long denominator) implements Comparable<Rational> {

    public static final Rational ZERO = new Rational(0, 1);
    public static final Rational ONE = new Rational(1, 1);

    public static final double DEFAULT_TOLERANCE = 1e-7;
    private static final int MAX_TERMS = 64;

    public Rational {
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

    public static Rational of(long value) {
        return new Rational(value, 1);
    }

    public static Rational of(long numerator, long denominator) {
        return new Rational(numerator, denominator);
    }

    public boolean isInteger() {
        return denominator == 1;
    }

    public boolean isZero() {
        return numerator == 0;
    }

    public int signum() {
        return Long.signum(numerator);
    }

    public double doubleValue() {
        return (double) numerator / denominator;
    }

    public Rational negate() {
        return new Rational(Math.negateExact(numerator), denominator);
    }

    public Rational abs() {
        return numerator < 0 ? negate() : this;
    }

    public Rational add(Rational other) {
        long n = Math.addExact(Math.multiplyExact(numerator, other.denominator),
                Math.multiplyExact(other.numerator, denominator));
        return new Rational(n, Math.multiplyExact(denominator, other.denominator));
    }

    public Rational subtract(Rational other) {
        return add(other.negate());
    }

    public Rational multiply(Rational other) {
        // cross-reduce first to delay overflow
        long g1 = Math.max(1, MathFunctions.gcd(numerator, other.denominator));
        long g2 = Math.max(1, MathFunctions.gcd(other.numerator, denominator));
        return new Rational(Math.multiplyExact(numerator / g1, other.numerator / g2),
                Math.multiplyExact(denominator / g2, other.denominator / g1));
    }

    public Rational divide(Rational other) {
        if (other.isZero()) {
            throw new DivisionByZeroException();
        }
        return multiply(new Rational(other.denominator, other.numerator));
    }

    /**
     * Raises this fraction to an integer power. 0^0 is left to the caller.
     */
    public Rational pow(long exponent) {
        if (exponent < 0) {
            if (isZero()) {
                throw new DivisionByZeroException();
            }
            return new Rational(denominator, numerator).pow(Math.negateExact(exponent));
        }
        Rational result = ONE;
        Rational base = this;
        long e = exponent;
        while (e > 0) {
            if ((e & 1) == 1) {
                result = result.multiply(base);
            }
            e >>= 1;
            if (e > 0) {
                base = base.multiply(base);
            }
        }
        return result;
    }

    @Override
    public int compareTo(Rational other) {
        return Long.compare(Math.multiplyExact(numerator, other.denominator),
                Math.multiplyExact(other.numerator, denominator));
    }

    /**
     * Parses "p", "p/q" or a decimal such as "-1.25".
     *
     * @throws SyntaxErrorException if the text is not a fraction
     */
    public static Rational parse(String text) {
        String trimmed = text.trim();
        try {
            int slash = trimmed.indexOf('/');
            if (slash >= 0) {
                return new Rational(Long.parseLong(trimmed.substring(0, slash).trim()),
                        Long.parseLong(trimmed.substring(slash + 1).trim()));
            }
            int dot = trimmed.indexOf('.');
            if (dot >= 0) {
                int decimals = trimmed.length() - dot - 1;
                long scale = pow10(decimals);
                long digits = Long.parseLong(trimmed.substring(0, dot) + trimmed.substring(dot + 1));
                return new Rational(digits, scale);
            }
            return of(Long.parseLong(trimmed));
        } catch (NumberFormatException | ArithmeticException e) {
            throw new SyntaxErrorException("Not a rational number: '" + text + "'");
        }
    }

    private static long pow10(int n) {
        long result = 1;
        for (int i = 0; i < n; i++) {
            result = Math.multiplyExact(result, 10L);
        }
        return result;
    }

    public static Rational fromDouble(double value) {
        return fromDouble(value, DEFAULT_TOLERANCE);
    }

    /**
     * Approximates a double by continued fractions, stopping once the relative error drops below the
     * tolerance or after a bounded number of terms.
     *
     * @throws ArithmeticException if the value is not finite or the convergents overflow
     */
    public static Rational fromDouble(double value, double tolerance) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ArithmeticException("Cannot convert " + value + " to a rational number");
        }
        if (value == Math.rint(value) && Math.abs(value) < 9.2e18) {
            return of((long) value);
        }
        long h0 = 1;
        long h1 = 0;
        long k0 = 0;
        long k1 = 1;
        double b = value;
        for (int i = 0; i < MAX_TERMS; i++) {
            double floor = Math.floor(b);
            long a = (long) floor;
            long h = Math.addExact(Math.multiplyExact(a, h0), h1);
            long k = Math.addExact(Math.multiplyExact(a, k0), k1);
            h1 = h0;
            h0 = h;
            k1 = k0;
            k0 = k;
            if (Math.abs(value - (double) h0 / k0) <= tolerance * Math.abs(value)) {
                break;
            }
            double fraction = b - floor;
            if (fraction == 0) {
                break;
            }
            b = 1 / fraction;
        }
        return new Rational(h0, k0);
    }

    @Override
    public String toString() {
        return denominator == 1 ? Long.toString(numerator) : numerator + "/" + denominator;
    }
}
