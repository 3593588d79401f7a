package org.finos.legend.math;

import org.finos.legend.math.ast.NodeVisitor;
import org.finos.legend.math.eval.ComplexEvaluator;
import org.finos.legend.math.lexer.Lexers;
import org.finos.legend.math.number.Complex;
import org.finos.legend.math.parser.ParserOptions;

import java.util.Map;

/**
 * Complex expressions such as "(1+2i)(3-i)" or "exp(i pi)".
 */
public final class ComplexMathEval extends MathEval<Complex, Object> {

    public ComplexMathEval() {
        this(ParserOptions.defaults());
    }

    public ComplexMathEval(ParserOptions options) {
        super(Lexers.complexMath(), options);
    }

    @Override
    protected NodeVisitor<Complex> evaluator(Map<String, ?> bindings) {
        return new ComplexEvaluator(bindings);
    }
}
