package org.finos.legend.math.error;

/**
 * Base class for every failure raised while tokenizing, parsing or evaluating an expression.
 * Errors are never recovered internally: any of them rejects the whole expression.
 */
public class MathExpressionException extends RuntimeException {

    public MathExpressionException(String message) {
        super(message);
    }

    public MathExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
