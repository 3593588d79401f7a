package org.finos.legend.math.lexer;

/**
 * Kinds of lexical units recognized by the lexer configurations.
 */
public enum TokenType {
    // Operands
    NATURAL_NUMBER, // 42
    INTEGER, // -2 (only produced programmatically)
    RATIONAL_NUMBER, // 3/4 (only produced programmatically)
    REAL_NUMBER, // 3.14, 1.5e-3
    BOOLEAN, // TRUE, false
    VARIABLE, // x, price
    CONSTANT, // pi, e, i, NAN, INF
    STRING, // .99 (decimal tail kept verbatim)

    // Prefix operators
    NOT, // NOT, !

    // Postfix operators
    FACTORIAL_OPERATOR, // !
    SEMI_FACTORIAL_OPERATOR, // !!

    // Infix operators
    ADDITION_OPERATOR, // +
    SUBTRACTION_OPERATOR, // -
    MULTIPLICATION_OPERATOR, // *
    DIVISION_OPERATOR, // /
    EXPONENTIAL_OPERATOR, // ^
    EQUAL_TO, // =
    DIFFERENT_THAN, // <>
    GREATER_THAN, // >
    LESS_THAN, // <
    GREATER_OR_EQUAL_THAN, // >=
    LESS_OR_EQUAL_THAN, // <=
    AND, // &&, AND
    OR, // ||, OR

    // Conditionals
    IF,
    THEN,
    ELSE,
    RETURN,

    FUNCTION_NAME, // sin, ending

    // Delimiters
    OPEN_PARENTHESIS,
    CLOSE_PARENTHESIS,
    OPEN_BRACE,
    CLOSE_BRACE,

    WHITESPACE,
    TERMINATOR; // , ; newline

    public boolean isRelational() {
        return switch (this) {
            case EQUAL_TO, DIFFERENT_THAN, GREATER_THAN, LESS_THAN, GREATER_OR_EQUAL_THAN, LESS_OR_EQUAL_THAN -> true;
            default -> false;
        };
    }

    public boolean isInfixOperator() {
        return switch (this) {
            case ADDITION_OPERATOR, SUBTRACTION_OPERATOR, MULTIPLICATION_OPERATOR, DIVISION_OPERATOR,
                    EXPONENTIAL_OPERATOR, AND, OR -> true;
            default -> isRelational();
        };
    }
}
