package org.finos.legend.math;

import org.finos.legend.math.ast.NodeVisitor;
import org.finos.legend.math.eval.PricingEvaluator;
import org.finos.legend.math.lexer.Lexers;
import org.finos.legend.math.parser.ParserOptions;

import java.util.Map;

/**
 * Pricing rules, e.g. "if (cost > 10) { return ending(cost * 1.2, .99); } else { return cost; }".
 */
public final class PricingEval extends MathEval<Object, Object> {

    public PricingEval() {
        this(ParserOptions.defaults().withImplicitMultiplication(false));
    }

    public PricingEval(ParserOptions options) {
        super(Lexers.pricing(), options);
    }

    @Override
    protected NodeVisitor<Object> evaluator(Map<String, ?> bindings) {
        return new PricingEvaluator(bindings);
    }
}
