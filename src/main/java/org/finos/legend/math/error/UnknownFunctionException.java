package org.finos.legend.math.error;

public class UnknownFunctionException extends MathExpressionException {

    private final String function;

    public UnknownFunctionException(String function) {
        super("Unknown function '" + function + "'");
        this.function = function;
    }

    public String getFunction() {
        return function;
    }
}
