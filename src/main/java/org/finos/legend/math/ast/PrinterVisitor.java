package org.finos.legend.math.ast;

/**
 * A visitor that can also render the structural placeholder nodes.
 */
public interface PrinterVisitor<T> extends NodeVisitor<T> {

    T visitPlaceholder(Node placeholder);
}
