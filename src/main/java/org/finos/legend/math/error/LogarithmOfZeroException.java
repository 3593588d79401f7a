package org.finos.legend.math.error;

public class LogarithmOfZeroException extends MathExpressionException {

    public LogarithmOfZeroException() {
        super("Logarithm of zero is undefined");
    }
}
