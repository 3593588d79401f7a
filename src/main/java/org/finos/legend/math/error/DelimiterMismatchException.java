package org.finos.legend.math.error;

/**
 * Thrown when an opening or closing delimiter has no matching partner.
 */
public class DelimiterMismatchException extends MathExpressionException {

    private final String delimiter;

    public DelimiterMismatchException(String delimiter) {
        super("Unable to match delimiter '" + delimiter + "'");
        this.delimiter = delimiter;
    }

    public String getDelimiter() {
        return delimiter;
    }
}
