package org.finos.legend.math.ast;

import org.finos.legend.math.error.SyntaxErrorException;

/**
 * Placeholder for a postfix operator symbol ("!" or "!!") not yet attached to its operand.
 */
public record PostfixNode(String symbol) implements Node {

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        if (visitor instanceof PrinterVisitor<T> printer) {
            return printer.visitPlaceholder(this);
        }
        throw new SyntaxErrorException("Unexpected postfix operator '" + symbol + "'");
    }
}
