package org.finos.legend.math;

import org.finos.legend.math.ast.NodeVisitor;
import org.finos.legend.math.eval.LogicEvaluator;
import org.finos.legend.math.lexer.Lexers;
import org.finos.legend.math.parser.ParserOptions;

import java.util.Map;

/**
 * Boolean and conditional expressions over named variables, e.g. "IF (x > 2 AND flag) THEN 1 ELSE 0".
 * Implicit multiplication is off since variable names span several letters.
 */
public final class LogicEval extends MathEval<Object, Object> {

    public LogicEval() {
        this(ParserOptions.defaults().withImplicitMultiplication(false));
    }

    public LogicEval(ParserOptions options) {
        super(Lexers.logic(), options);
    }

    @Override
    protected NodeVisitor<Object> evaluator(Map<String, ?> bindings) {
        return new LogicEvaluator(bindings);
    }
}
