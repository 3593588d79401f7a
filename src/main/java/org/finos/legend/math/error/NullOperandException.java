package org.finos.legend.math.error;

/**
 * Thrown when an operator node is missing an operand it needs.
 */
public class NullOperandException extends MathExpressionException {

    private final String operator;

    public NullOperandException(String operator) {
        super("Missing operand for '" + operator + "'");
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
