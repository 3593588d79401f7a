package org.finos.legend.math.error;

/**
 * Thrown when the token sequence does not form a well-formed expression.
 */
public class SyntaxErrorException extends MathExpressionException {

    private final String detail;

    public SyntaxErrorException(String detail) {
        super("Syntax error: " + detail);
        this.detail = detail;
    }

    public String getDetail() {
        return detail;
    }
}
