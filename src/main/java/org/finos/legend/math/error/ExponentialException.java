package org.finos.legend.math.error;

/**
 * Thrown for the undefined form 0^0.
 */
public class ExponentialException extends MathExpressionException {

    public ExponentialException() {
        super("Exponential 0^0 is undefined");
    }
}
