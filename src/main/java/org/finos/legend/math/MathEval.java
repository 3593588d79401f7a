package org.finos.legend.math;

import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.NodeVisitor;
import org.finos.legend.math.lexer.Lexer;
import org.finos.legend.math.lexer.Token;
import org.finos.legend.math.parser.Parser;
import org.finos.legend.math.parser.ParserOptions;

import java.util.List;
import java.util.Map;

/**
 * Lexer, parser and evaluator of one expression language wired together.
 *
 * Instances hold only immutable configuration and may be shared; every evaluation creates a fresh evaluator.
 *
 * @param <T> The result type of evaluation
 * @param <B> The type of the values bound to variables
 */
public abstract class MathEval<T, B> {

    private final Lexer lexer;
    private final Parser parser;

    protected MathEval(Lexer lexer, ParserOptions options) {
        this.lexer = lexer;
        this.parser = new Parser(options);
    }

    public Lexer getLexer() {
        return lexer;
    }

    public Parser getParser() {
        return parser;
    }

    public List<Token> tokenize(String text) {
        return lexer.tokenize(text);
    }

    public Node parse(String text) {
        return parser.parse(lexer.tokenize(text));
    }

    public T evaluate(String text) {
        return evaluate(text, Map.of());
    }

    public T evaluate(String text, Map<String, ? extends B> bindings) {
        return evaluate(parse(text), bindings);
    }

    public T evaluate(Node tree, Map<String, ? extends B> bindings) {
        return tree.accept(evaluator(bindings));
    }

    protected abstract NodeVisitor<T> evaluator(Map<String, ? extends B> bindings);
}
