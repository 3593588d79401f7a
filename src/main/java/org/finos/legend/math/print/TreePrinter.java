package org.finos.legend.math.print;

import org.finos.legend.math.ast.BooleanNode;
import org.finos.legend.math.ast.ConstantNode;
import org.finos.legend.math.ast.FloatNode;
import org.finos.legend.math.ast.FunctionNode;
import org.finos.legend.math.ast.InfixNode;
import org.finos.legend.math.ast.IntegerNode;
import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.PrinterVisitor;
import org.finos.legend.math.ast.RationalNode;
import org.finos.legend.math.ast.StringNode;
import org.finos.legend.math.ast.TernaryNode;
import org.finos.legend.math.ast.VariableNode;

/**
 * Prints a tree on one line in prefix form, e.g. (+ 1 (* 2 x)). Useful to see how an
 * expression was grouped.
 */
public final class TreePrinter implements PrinterVisitor<String> {

    private final AsciiPrinter placeholders = new AsciiPrinter();

    public static String print(Node node) {
        return node.accept(new TreePrinter());
    }

    @Override
    public String visitInteger(IntegerNode node) {
        return Long.toString(node.value());
    }

    @Override
    public String visitRational(RationalNode node) {
        return node.numerator() + "/" + node.denominator();
    }

    @Override
    public String visitFloat(FloatNode node) {
        return Double.toString(node.value());
    }

    @Override
    public String visitBoolean(BooleanNode node) {
        return node.toString();
    }

    @Override
    public String visitVariable(VariableNode node) {
        return node.name();
    }

    @Override
    public String visitConstant(ConstantNode node) {
        return node.name();
    }

    @Override
    public String visitString(StringNode node) {
        return "\"" + node.value() + "\"";
    }

    @Override
    public String visitInfix(InfixNode node) {
        String operands = node.isUnary()
                ? node.left().accept(this)
                : node.left().accept(this) + " " + node.right().accept(this);
        return "(" + node.operator().symbol() + " " + operands + ")";
    }

    @Override
    public String visitTernary(TernaryNode node) {
        return "(if " + node.condition().accept(this) + " " + node.thenBranch().accept(this) + " "
                + node.elseBranch().accept(this) + ")";
    }

    @Override
    public String visitFunction(FunctionNode node) {
        StringBuilder text = new StringBuilder("(").append(node.name());
        for (Node argument : node.arguments()) {
            text.append(' ').append(argument.accept(this));
        }
        return text.append(')').toString();
    }

    @Override
    public String visitPlaceholder(Node placeholder) {
        return placeholders.visitPlaceholder(placeholder);
    }
}
