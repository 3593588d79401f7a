package org.finos.legend.math.ast;

import org.finos.legend.math.error.UnknownOperatorException;

import java.util.Arrays;

/**
 * Infix and prefix operators with their precedence and associativity.
 * A higher precedence binds tighter.
 */
public enum Operator {
    AND("&&", "AND", 1, Associativity.LEFT),
    OR("||", "OR", 1, Associativity.LEFT),
    NOT("NOT", "!", 1, Associativity.LEFT),
    EQUAL("=", null, 2, Associativity.LEFT),
    NOT_EQUAL("<>", null, 2, Associativity.LEFT),
    GREATER(">", null, 2, Associativity.LEFT),
    LESS("<", null, 2, Associativity.LEFT),
    GREATER_OR_EQUAL(">=", null, 2, Associativity.LEFT),
    LESS_OR_EQUAL("<=", null, 2, Associativity.LEFT),
    ADD("+", null, 3, Associativity.LEFT),
    SUBTRACT("-", null, 3, Associativity.LEFT),
    MULTIPLY("*", null, 4, Associativity.LEFT),
    DIVIDE("/", null, 4, Associativity.LEFT),
    POWER("^", null, 5, Associativity.RIGHT);

    private final String symbol;
    private final String synonym;
    private final int precedence;
    private final Associativity associativity;

    Operator(String symbol, String synonym, int precedence, Associativity associativity) {
        this.symbol = symbol;
        this.synonym = synonym;
        this.precedence = precedence;
        this.associativity = associativity;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public Associativity associativity() {
        return associativity;
    }

    public boolean isRelational() {
        return precedence == 2;
    }

    public boolean isBoolean() {
        return this == AND || this == OR || this == NOT;
    }

    /**
     * True for operators whose result is a boolean; these nodes are dispatched to
     * {@link NodeVisitor#visitLogicalInfix}.
     */
    public boolean isLogical() {
        return isRelational() || isBoolean();
    }

    /**
     * Applies a relational operator to the result of a three-way comparison.
     *
     * @throws UnknownOperatorException if this operator is not relational
     */
    public boolean holds(int comparison) {
        return switch (this) {
            case EQUAL -> comparison == 0;
            case NOT_EQUAL -> comparison != 0;
            case GREATER -> comparison > 0;
            case LESS -> comparison < 0;
            case GREATER_OR_EQUAL -> comparison >= 0;
            case LESS_OR_EQUAL -> comparison <= 0;
            default -> throw new UnknownOperatorException(symbol);
        };
    }

    public static Operator fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(symbol) || symbol.equals(op.synonym))
                .findFirst()
                .orElseThrow(() -> new UnknownOperatorException(symbol));
    }
}
