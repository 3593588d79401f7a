package org.finos.legend.math;

import org.finos.legend.math.ast.NodeVisitor;
import org.finos.legend.math.eval.RationalEvaluator;
import org.finos.legend.math.lexer.Lexers;
import org.finos.legend.math.number.Rational;
import org.finos.legend.math.parser.ParserOptions;

import java.util.Map;

/**
 * Exact fraction arithmetic over the real-math syntax, e.g. "1/3 + 1/6" is 1/2.
 */
public final class RationalMathEval extends MathEval<Rational, Object> {

    public RationalMathEval() {
        this(ParserOptions.defaults());
    }

    public RationalMathEval(ParserOptions options) {
        super(Lexers.stdMath(), options);
    }

    @Override
    protected NodeVisitor<Rational> evaluator(Map<String, ?> bindings) {
        return new RationalEvaluator(bindings);
    }
}
