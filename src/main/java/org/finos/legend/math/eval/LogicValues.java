package org.finos.legend.math.eval;

import org.finos.legend.math.error.UnexpectedValueException;

/**
 * Conversions between the values a logic expression handles: Double, Boolean and String.
 */
public final class LogicValues {

    private LogicValues() {
    }

    /**
     * Numeric view of a value. Booleans count as 1 and 0, strings must hold a number.
     */
    public static double toNumber(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new UnexpectedValueException("Not a number: '" + s + "'");
            }
        }
        throw new UnexpectedValueException("Not a number: " + value);
    }

    /**
     * Truth value: booleans as such, numbers when nonzero (NaN is false), strings when non-empty.
     */
    public static boolean isTruthy(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return value != null;
    }

    /**
     * Three-way comparison. Two strings compare lexically, two booleans as false < true,
     * anything else numerically.
     */
    public static int compare(Object left, Object right) {
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        if (left instanceof Boolean l && right instanceof Boolean r) {
            return Boolean.compare(l, r);
        }
        double a = toNumber(left);
        double b = toNumber(right);
        return a == b ? 0 : Double.compare(a, b);
    }
}
