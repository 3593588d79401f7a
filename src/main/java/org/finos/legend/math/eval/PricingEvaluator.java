package org.finos.legend.math.eval;

import org.finos.legend.math.ast.FunctionNode;
import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.StringNode;
import org.finos.legend.math.error.SyntaxErrorException;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Evaluates pricing rules: logic expressions plus the price-ending function.
 *
 * ending(value, tail) cuts the value down to whole cents and replaces its last characters with the
 * tail, so ending(12.34, .99) is 12.99 and ending(12.34, 9.99) is 19.99.
 */
public class PricingEvaluator extends LogicEvaluator {

    private static final Pattern TAIL = Pattern.compile("\\d*\\.\\d\\d");
    // keeps 19.99 * 100 from flooring to 1998
    private static final double CENT_EPSILON = 1e-6;

    public PricingEvaluator() {
        super();
    }

    public PricingEvaluator(Map<String, ?> bindings) {
        super(bindings);
    }

    @Override
    public Object visitFunction(FunctionNode node) {
        if ("ending".equals(node.name())) {
            return ending(number(node.arguments().get(0)), tail(node.arguments().get(1)));
        }
        return super.visitFunction(node);
    }

    private String tail(Node argument) {
        String text = argument instanceof StringNode s
                ? s.value()
                : String.format(Locale.ROOT, "%.2f", number(argument));
        if (!TAIL.matcher(text).matches()) {
            throw new SyntaxErrorException("Invalid price ending '" + text + "'");
        }
        return text;
    }

    static double ending(double value, String tail) {
        double cents = Math.floor(value * 100 + CENT_EPSILON) / 100;
        String formatted = String.format(Locale.ROOT, "%.2f", cents);
        if (tail.length() >= formatted.length()) {
            throw new SyntaxErrorException("Price ending '" + tail + "' is too long for " + formatted);
        }
        return Double.parseDouble(formatted.substring(0, formatted.length() - tail.length()) + tail);
    }
}
