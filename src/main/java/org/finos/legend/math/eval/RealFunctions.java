package org.finos.legend.math.eval;

import org.finos.legend.math.error.LogarithmOfZeroException;
import org.finos.legend.math.error.UnknownFunctionException;
import org.finos.legend.math.number.MathFunctions;

import java.util.Set;

/**
 * The real-valued function table shared by the double-based evaluators.
 */
public final class RealFunctions {

    public static final Set<String> NAMES = Set.of(
            "sin", "cos", "tan", "cot", "sind", "cosd", "tand", "cotd",
            "arcsin", "arccos", "arctan", "arccot",
            "sinh", "cosh", "tanh", "coth", "arsinh", "arcosh", "artanh", "arcoth",
            "exp", "log", "ln", "lg", "sqrt", "abs", "sgn", "!", "!!", "round", "floor", "ceil");

    private RealFunctions() {
    }

    public static boolean isKnown(String name) {
        return NAMES.contains(name);
    }

    /**
     * Applies a single-argument function.
     *
     * @throws UnknownFunctionException  if the name is not in the table
     * @throws LogarithmOfZeroException  for log, ln or lg of zero
     */
    public static double apply(String name, double x) {
        return switch (name) {
            case "sin" -> Math.sin(x);
            case "cos" -> Math.cos(x);
            case "tan" -> Math.tan(x);
            case "cot" -> 1 / Math.tan(x);
            case "sind" -> Math.sin(Math.toRadians(x));
            case "cosd" -> Math.cos(Math.toRadians(x));
            case "tand" -> Math.tan(Math.toRadians(x));
            case "cotd" -> 1 / Math.tan(Math.toRadians(x));
            case "arcsin" -> Math.asin(x);
            case "arccos" -> Math.acos(x);
            case "arctan" -> Math.atan(x);
            case "arccot" -> Math.PI / 2 - Math.atan(x);
            case "sinh" -> Math.sinh(x);
            case "cosh" -> Math.cosh(x);
            case "tanh" -> Math.tanh(x);
            case "coth" -> 1 / Math.tanh(x);
            case "arsinh" -> Math.log(x + Math.sqrt(x * x + 1));
            case "arcosh" -> Math.log(x + Math.sqrt(x * x - 1));
            case "artanh" -> 0.5 * Math.log((1 + x) / (1 - x));
            case "arcoth" -> 0.5 * Math.log((x + 1) / (x - 1));
            case "exp" -> Math.exp(x);
            case "log", "ln" -> Math.log(nonZero(x));
            case "lg" -> Math.log10(nonZero(x));
            case "sqrt" -> Math.sqrt(x);
            case "abs" -> Math.abs(x);
            case "sgn" -> Math.signum(x);
            case "!" -> MathFunctions.factorial(x);
            case "!!" -> MathFunctions.semiFactorial(x);
            case "round" -> round(x);
            case "floor" -> Math.floor(x);
            case "ceil" -> Math.ceil(x);
            default -> throw new UnknownFunctionException(name);
        };
    }

    private static double nonZero(double x) {
        if (x == 0) {
            throw new LogarithmOfZeroException();
        }
        return x;
    }

    // half away from zero
    private static double round(double x) {
        return Math.signum(x) * Math.floor(Math.abs(x) + 0.5);
    }
}
