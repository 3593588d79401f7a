package org.finos.legend.math.ast;

/**
 * A leaf carrying a value or a name.
 */
public sealed interface OperandNode extends Node
        permits NumericNode, BooleanNode, ConstantNode, VariableNode, StringNode {
}
