package org.finos.legend.math.error;

/**
 * Thrown when a value falls outside the domain an evaluator can represent,
 * e.g. an irrational result in exact rational arithmetic.
 */
public class UnexpectedValueException extends MathExpressionException {

    private final String detail;

    public UnexpectedValueException(String detail) {
        super(detail);
        this.detail = detail;
    }

    public String getDetail() {
        return detail;
    }
}
