package org.finos.legend.math.ast;

/**
 * Visitor interface for walking expression trees.
 *
 * Each node calls exactly one method. Logic-aware visitors override {@link #visitLogicalInfix};
 * arithmetic visitors see relational and boolean operators through {@link #visitInfix}.
 *
 * @param <T> The return type of the visitor methods
 */
public interface NodeVisitor<T> {

    T visitInteger(IntegerNode node);

    T visitRational(RationalNode node);

    T visitFloat(FloatNode node);

    T visitBoolean(BooleanNode node);

    /**
     * Visit a variable; lookups of unbound names fail with UnknownVariableException.
     */
    T visitVariable(VariableNode node);

    /**
     * Visit a named constant; names the visitor does not know fail with UnknownConstantException.
     */
    T visitConstant(ConstantNode node);

    T visitString(StringNode node);

    /**
     * Visit an arithmetic operation or unary minus.
     */
    T visitInfix(InfixNode node);

    /**
     * Visit a relational or boolean operation. Defaults to {@link #visitInfix}.
     */
    default T visitLogicalInfix(InfixNode node) {
        return visitInfix(node);
    }

    T visitTernary(TernaryNode node);

    T visitFunction(FunctionNode node);
}
