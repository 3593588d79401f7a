package org.finos.legend.math.ast;

/**
 * How operators of equal precedence group.
 */
public enum Associativity {
    LEFT,
    RIGHT
}
