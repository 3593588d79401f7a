package org.finos.legend.math.ast;

import org.finos.legend.math.error.SyntaxErrorException;

public record CloseParenthesisNode() implements Node {

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        if (visitor instanceof PrinterVisitor<T> printer) {
            return printer.visitPlaceholder(this);
        }
        throw new SyntaxErrorException("Unexpected ')'");
    }
}
