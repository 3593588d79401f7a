package org.finos.legend.math.error;

public class UnknownConstantException extends MathExpressionException {

    private final String constant;

    public UnknownConstantException(String constant) {
        super("Unknown constant '" + constant + "'");
        this.constant = constant;
    }

    public String getConstant() {
        return constant;
    }
}
