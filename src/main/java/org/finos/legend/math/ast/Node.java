package org.finos.legend.math.ast;

/**
 * A node of the expression tree.
 *
 * Nodes are immutable and compared structurally. Operand nodes are leaves; {@link InfixNode},
 * {@link TernaryNode} and {@link FunctionNode} hold children. {@link PostfixNode},
 * {@link CloseParenthesisNode} and {@link CloseBraceNode} are structural placeholders that only
 * printers can visit.
 */
public sealed interface Node
        permits OperandNode, InfixNode, TernaryNode, FunctionNode,
        PostfixNode, CloseParenthesisNode, CloseBraceNode {

    /**
     * Accept method for the visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this node
     */
    <T> T accept(NodeVisitor<T> visitor);
}
