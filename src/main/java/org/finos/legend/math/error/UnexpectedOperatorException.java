package org.finos.legend.math.error;

/**
 * Thrown when an operator appears where the grammar does not allow it, e.g. a postfix
 * factorial directly after another operator.
 */
public class UnexpectedOperatorException extends MathExpressionException {

    private final String operator;

    public UnexpectedOperatorException(String operator) {
        super("Unexpected operator '" + operator + "'");
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
