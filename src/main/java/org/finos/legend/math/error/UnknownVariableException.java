package org.finos.legend.math.error;

public class UnknownVariableException extends MathExpressionException {

    private final String variable;

    public UnknownVariableException(String variable) {
        super("Unknown variable '" + variable + "'");
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
