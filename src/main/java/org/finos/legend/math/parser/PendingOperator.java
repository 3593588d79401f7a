package org.finos.legend.math.parser;

import org.finos.legend.math.ast.Associativity;
import org.finos.legend.math.ast.Operator;
import org.finos.legend.math.lexer.Token;

/**
 * An entry of the operator stack. Delimiters and conditionals remember how many operands were on the
 * operand stack when they were opened, so the parser can tell what they produced.
 */
final class PendingOperator {

    enum Kind {
        BINARY,
        PREFIX,
        OPEN_PARENTHESIS,
        OPEN_BRACE,
        FUNCTION,
        CONDITIONAL
    }

    enum Stage {
        CONDITION,
        THEN,
        ELSE
    }

    private final Kind kind;
    private final Operator operator;
    private final String functionName;
    private final int operandDepth;
    private final Token token;
    private Stage stage = Stage.CONDITION;

    private PendingOperator(Kind kind, Operator operator, String functionName, int operandDepth, Token token) {
        this.kind = kind;
        this.operator = operator;
        this.functionName = functionName;
        this.operandDepth = operandDepth;
        this.token = token;
    }

    static PendingOperator binary(Operator operator, Token token) {
        return new PendingOperator(Kind.BINARY, operator, null, -1, token);
    }

    static PendingOperator prefix(Operator operator, Token token) {
        return new PendingOperator(Kind.PREFIX, operator, null, -1, token);
    }

    static PendingOperator delimiter(Kind kind, int operandDepth, Token token) {
        return new PendingOperator(kind, null, null, operandDepth, token);
    }

    static PendingOperator function(String name, int operandDepth, Token token) {
        return new PendingOperator(Kind.FUNCTION, null, name, operandDepth, token);
    }

    static PendingOperator conditional(int operandDepth, Token token) {
        return new PendingOperator(Kind.CONDITIONAL, null, null, operandDepth, token);
    }

    Kind kind() {
        return kind;
    }

    Operator operator() {
        return operator;
    }

    String functionName() {
        return functionName;
    }

    int operandDepth() {
        return operandDepth;
    }

    Token token() {
        return token;
    }

    Stage stage() {
        return stage;
    }

    void advanceTo(Stage next) {
        this.stage = next;
    }

    boolean isOperator() {
        return kind == Kind.BINARY || kind == Kind.PREFIX;
    }

    boolean isDelimiter() {
        return kind == Kind.OPEN_PARENTHESIS || kind == Kind.OPEN_BRACE || kind == Kind.FUNCTION;
    }

    boolean isCompleteConditional() {
        return kind == Kind.CONDITIONAL && stage == Stage.ELSE;
    }

    /**
     * True if an incoming binary operator must first reduce this one.
     */
    boolean bindsTighterThan(Operator incoming) {
        if (!isOperator()) {
            return false;
        }
        int own = operator.precedence();
        return own > incoming.precedence()
                || own == incoming.precedence() && incoming.associativity() == Associativity.LEFT;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case BINARY -> operator.symbol();
            case PREFIX -> "u" + operator.symbol();
            case OPEN_PARENTHESIS -> "(";
            case OPEN_BRACE -> "{";
            case FUNCTION -> functionName + "(";
            case CONDITIONAL -> "IF[" + stage + "]";
        };
    }
}
