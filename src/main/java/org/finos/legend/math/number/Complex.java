package org.finos.legend.math.number;

import org.finos.legend.math.error.DivisionByZeroException;
import org.finos.legend.math.error.ExponentialException;
import org.finos.legend.math.error.LogarithmOfZeroException;
import org.finos.legend.math.error.SyntaxErrorException;

/**
 * A complex number in rectangular form. Multi-valued functions return their principal value.
 *
 * @param re The real part
 * @param im The imaginary part
 */
public record Complex(double re, double im) {

    public static final Complex ZERO = new Complex(0, 0);
    public static final Complex ONE = new Complex(1, 0);
    public static final Complex I = new Complex(0, 1);

    private static final long MAX_FRIENDLY_DENOMINATOR = 100;

    public static Complex real(double re) {
        return new Complex(re, 0);
    }

    public boolean isReal() {
        return im == 0;
    }

    public boolean isZero() {
        return re == 0 && im == 0;
    }

    public Complex add(Complex other) {
        return new Complex(re + other.re, im + other.im);
    }

    public Complex subtract(Complex other) {
        return new Complex(re - other.re, im - other.im);
    }

    public Complex multiply(Complex other) {
        return new Complex(re * other.re - im * other.im, re * other.im + im * other.re);
    }

    public Complex multiply(double factor) {
        return new Complex(re * factor, im * factor);
    }

    public Complex divide(Complex other) {
        if (other.isZero()) {
            throw new DivisionByZeroException();
        }
        double d = other.re * other.re + other.im * other.im;
        return new Complex((re * other.re + im * other.im) / d, (im * other.re - re * other.im) / d);
    }

    public Complex negate() {
        return new Complex(-re, -im);
    }

    public Complex conj() {
        return new Complex(re, -im);
    }

    public double abs() {
        return Math.hypot(re, im);
    }

    public double arg() {
        return Math.atan2(im, re);
    }

    /**
     * Integer power by repeated squaring.
     */
    public Complex pow(long exponent) {
        if (exponent < 0) {
            if (isZero()) {
                throw new DivisionByZeroException();
            }
            return ONE.divide(pow(-exponent));
        }
        Complex result = ONE;
        Complex base = this;
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

    /**
     * Principal value of this^w, computed as exp(w log z) unless w is a real integer.
     *
     * @throws ExponentialException for 0^0
     */
    public Complex pow(Complex w) {
        if (isZero()) {
            if (w.isZero()) {
                throw new ExponentialException();
            }
            if (w.re > 0) {
                return ZERO;
            }
            throw new DivisionByZeroException();
        }
        if (w.isReal() && MathFunctions.isIntegral(w.re) && Math.abs(w.re) < 1 << 20) {
            return pow((long) w.re);
        }
        return w.multiply(log()).exp();
    }

    public Complex exp() {
        double r = Math.exp(re);
        return new Complex(r * Math.cos(im), r * Math.sin(im));
    }

    public Complex log() {
        if (isZero()) {
            throw new LogarithmOfZeroException();
        }
        return new Complex(Math.log(abs()), arg());
    }

    public Complex sqrt() {
        if (isZero()) {
            return ZERO;
        }
        double r = abs();
        double a = Math.sqrt((r + re) / 2);
        double b = Math.sqrt((r - re) / 2);
        return new Complex(a, im < 0 ? -b : b);
    }

    public Complex sin() {
        return new Complex(Math.sin(re) * Math.cosh(im), Math.cos(re) * Math.sinh(im));
    }

    public Complex cos() {
        return new Complex(Math.cos(re) * Math.cosh(im), -Math.sin(re) * Math.sinh(im));
    }

    public Complex tan() {
        return sin().divide(cos());
    }

    public Complex cot() {
        return cos().divide(sin());
    }

    public Complex sinh() {
        return new Complex(Math.sinh(re) * Math.cos(im), Math.cosh(re) * Math.sin(im));
    }

    public Complex cosh() {
        return new Complex(Math.cosh(re) * Math.cos(im), Math.sinh(re) * Math.sin(im));
    }

    public Complex tanh() {
        return sinh().divide(cosh());
    }

    public Complex coth() {
        return cosh().divide(sinh());
    }

    // arcsin z = -i log(iz + sqrt(1 - z^2))
    public Complex arcsin() {
        Complex root = ONE.subtract(multiply(this)).sqrt();
        return I.multiply(this).add(root).log().multiply(I).negate();
    }

    public Complex arccos() {
        return real(Math.PI / 2).subtract(arcsin());
    }

    // arctan z = i/2 (log(1 - iz) - log(1 + iz))
    public Complex arctan() {
        Complex iz = I.multiply(this);
        return ONE.subtract(iz).log().subtract(ONE.add(iz).log()).multiply(new Complex(0, 0.5));
    }

    public Complex arccot() {
        return ONE.divide(this).arctan();
    }

    public Complex arsinh() {
        return add(multiply(this).add(ONE).sqrt()).log();
    }

    public Complex arcosh() {
        return add(add(ONE).sqrt().multiply(subtract(ONE).sqrt())).log();
    }

    public Complex artanh() {
        return ONE.add(this).divide(ONE.subtract(this)).log().multiply(0.5);
    }

    public Complex arcoth() {
        return add(ONE).divide(subtract(ONE)).log().multiply(0.5);
    }

    /**
     * Parses forms such as "3", "-1.5", "1/2", "2i", "-i", "3+4i" and "1/2-3/4i".
     *
     * @throws SyntaxErrorException if the text is not a complex number
     */
    public static Complex parse(String text) {
        String s = text.replace(" ", "");
        if (s.isEmpty()) {
            throw new SyntaxErrorException("Not a complex number: '" + text + "'");
        }
        if (!s.endsWith("i")) {
            return real(parsePart(s, text));
        }
        String body = s.substring(0, s.length() - 1);
        int split = -1;
        for (int k = body.length() - 1; k > 0; k--) {
            char c = body.charAt(k);
            if ((c == '+' || c == '-') && Character.toLowerCase(body.charAt(k - 1)) != 'e') {
                split = k;
                break;
            }
        }
        String realText = split < 0 ? "" : body.substring(0, split);
        String imaginaryText = split < 0 ? body : body.substring(split);
        double imaginary;
        if (imaginaryText.isEmpty() || imaginaryText.equals("+")) {
            imaginary = 1;
        } else if (imaginaryText.equals("-")) {
            imaginary = -1;
        } else {
            imaginary = parsePart(imaginaryText, text);
        }
        return new Complex(realText.isEmpty() ? 0 : parsePart(realText, text), imaginary);
    }

    private static double parsePart(String part, String text) {
        try {
            if (part.indexOf('/') >= 0) {
                return Rational.parse(part).doubleValue();
            }
            return Double.parseDouble(part);
        } catch (NumberFormatException | SyntaxErrorException e) {
            throw new SyntaxErrorException("Not a complex number: '" + text + "'");
        }
    }

    @Override
    public String toString() {
        if (im == 0) {
            return format(re);
        }
        String imaginary = Math.abs(im) == 1 ? "i" : format(Math.abs(im)) + "i";
        if (re == 0) {
            return (im < 0 ? "-" : "") + imaginary;
        }
        return format(re) + (im < 0 ? "-" : "+") + imaginary;
    }

    private static String format(double x) {
        if (MathFunctions.isIntegral(x)) {
            return Long.toString((long) x);
        }
        if (!Double.isNaN(x) && !Double.isInfinite(x)) {
            try {
                Rational r = Rational.fromDouble(x);
                if (r.denominator() <= MAX_FRIENDLY_DENOMINATOR) {
                    return r.toString();
                }
            } catch (ArithmeticException overflow) {
                // convergents left the long range, plain decimal below
            }
        }
        return Double.toString(x);
    }
}
