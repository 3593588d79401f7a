package org.finos.legend.math.error;

public class UnknownOperatorException extends MathExpressionException {

    private final String operator;

    public UnknownOperatorException(String operator) {
        super("Unknown operator '" + operator + "'");
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
