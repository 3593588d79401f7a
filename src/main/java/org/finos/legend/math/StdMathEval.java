package org.finos.legend.math;

import org.finos.legend.math.ast.NodeVisitor;
import org.finos.legend.math.eval.StdMathEvaluator;
import org.finos.legend.math.lexer.Lexers;
import org.finos.legend.math.parser.ParserOptions;

import java.util.Map;

/**
 * Real-valued expressions such as "2x + sin(pi/4)".
 */
public final class StdMathEval extends MathEval<Double, Number> {

    public StdMathEval() {
        this(ParserOptions.defaults());
    }

    public StdMathEval(ParserOptions options) {
        super(Lexers.stdMath(), options);
    }

    @Override
    protected NodeVisitor<Double> evaluator(Map<String, ? extends Number> bindings) {
        return new StdMathEvaluator(bindings);
    }
}
