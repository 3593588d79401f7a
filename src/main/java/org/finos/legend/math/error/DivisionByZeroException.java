package org.finos.legend.math.error;

public class DivisionByZeroException extends MathExpressionException {

    public DivisionByZeroException() {
        super("Division by zero");
    }
}
