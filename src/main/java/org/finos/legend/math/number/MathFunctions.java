package org.finos.legend.math.number;

/**
 * Integer and special functions shared by the evaluators and the simplifier.
 */
public final class MathFunctions {

    private static final double[] LANCZOS = {
            0.99999999999980993,
            676.5203681218851,
            -1259.1392167224028,
            771.32342877765313,
            -176.61502916214059,
            12.507343278686905,
            -0.13857109526572012,
            9.9843695780195716e-6,
            1.5056327351493116e-7
    };

    private MathFunctions() {
    }

    /**
     * Greatest common divisor, always non-negative. gcd(0, 0) is 0.
     */
    public static long gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    /**
     * n! for a non-negative integer.
     *
     * @throws ArithmeticException if n is negative or the result overflows a long
     */
    public static long factorial(long n) {
        if (n < 0) {
            throw new ArithmeticException("Factorial of negative number: " + n);
        }
        long result = 1;
        for (long k = 2; k <= n; k++) {
            result = Math.multiplyExact(result, k);
        }
        return result;
    }

    /**
     * n!! = n(n-2)(n-4)... for a non-negative integer.
     *
     * @throws ArithmeticException if n is negative or the result overflows a long
     */
    public static long semiFactorial(long n) {
        if (n < 0) {
            throw new ArithmeticException("Semi-factorial of negative number: " + n);
        }
        long result = 1;
        for (long k = n; k > 1; k -= 2) {
            result = Math.multiplyExact(result, k);
        }
        return result;
    }

    /**
     * Natural logarithm of the gamma function (Lanczos approximation, g = 7).
     * Uses the reflection formula below 1/2, so negative non-integers are accepted.
     */
    public static double logGamma(double x) {
        if (x < 0.5) {
            return Math.log(Math.PI / Math.abs(Math.sin(Math.PI * x))) - logGamma(1 - x);
        }
        x -= 1;
        double a = LANCZOS[0];
        double t = x + 7.5;
        for (int i = 1; i < LANCZOS.length; i++) {
            a += LANCZOS[i] / (x + i);
        }
        return 0.5 * Math.log(2 * Math.PI) + (x + 0.5) * Math.log(t) - t + Math.log(a);
    }

    /**
     * x! for real x, via exp(logGamma(1 + x)). Exact for small natural numbers.
     */
    public static double factorial(double x) {
        if (x >= 0 && x <= 20 && x == Math.rint(x)) {
            return factorial((long) x);
        }
        return Math.exp(logGamma(1 + x));
    }

    /**
     * x!! for real x. Natural numbers are computed exactly; others through the gamma function,
     * using the even/odd closed forms.
     */
    public static double semiFactorial(double x) {
        if (x >= 0 && x <= 33 && x == Math.rint(x)) {
            return semiFactorial((long) x);
        }
        if (x == Math.rint(x) && ((long) x) % 2 == 0) {
            double half = x / 2;
            return Math.pow(2, half) * Math.exp(logGamma(half + 1));
        }
        double half = (x + 1) / 2;
        return Math.pow(2, half) * Math.exp(logGamma(half + 0.5)) / Math.sqrt(Math.PI);
    }

    /**
     * Returns true if the double holds an integer value representable as a long.
     */
    public static boolean isIntegral(double x) {
        return !Double.isInfinite(x) && x == Math.rint(x) && Math.abs(x) < 9.2e18;
    }
}
