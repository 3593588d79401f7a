package org.finos.legend.math.print;

import org.finos.legend.math.ast.BooleanNode;
import org.finos.legend.math.ast.CloseBraceNode;
import org.finos.legend.math.ast.CloseParenthesisNode;
import org.finos.legend.math.ast.ConstantNode;
import org.finos.legend.math.ast.FloatNode;
import org.finos.legend.math.ast.FunctionNode;
import org.finos.legend.math.ast.InfixNode;
import org.finos.legend.math.ast.IntegerNode;
import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.Operator;
import org.finos.legend.math.ast.PostfixNode;
import org.finos.legend.math.ast.PrinterVisitor;
import org.finos.legend.math.ast.RationalNode;
import org.finos.legend.math.ast.StringNode;
import org.finos.legend.math.ast.TernaryNode;
import org.finos.legend.math.ast.VariableNode;

import java.util.stream.Collectors;

/**
 * Prints a tree as expression text that the lexer of its language reads back into an equal tree.
 * Parentheses are only written where precedence or associativity requires them.
 */
public final class AsciiPrinter implements PrinterVisitor<String> {

    static final int ATOM = 6;
    private static final int PREFIX_MINUS = Operator.SUBTRACT.precedence();
    private static final int CONDITIONAL = 0;

    public static String print(Node node) {
        return node.accept(new AsciiPrinter());
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
        double value = node.value();
        if (Double.isNaN(value)) {
            return "NAN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "INF" : "-INF";
        }
        // the lexer reads a lowercase exponent only
        return Double.toString(value).replace('E', 'e');
    }

    @Override
    public String visitBoolean(BooleanNode node) {
        return node.value() ? "TRUE" : "FALSE";
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
        return node.value();
    }

    @Override
    public String visitInfix(InfixNode node) {
        Operator operator = node.operator();
        if (node.isUnary()) {
            String prefix = operator == Operator.NOT ? "NOT " : "-";
            int own = operator == Operator.NOT ? Operator.NOT.precedence() : PREFIX_MINUS;
            return prefix + wrap(node.left(), precedence(node.left()) <= own);
        }
        int own = operator.precedence();
        boolean rightAssociative = operator == Operator.POWER;
        int left = precedence(node.left());
        int right = precedence(node.right());
        String l = wrap(node.left(), left < own || left == own && rightAssociative);
        String r = wrap(node.right(), right < own || right == own && !rightAssociative);
        String separator = operator.isLogical() ? " " : "";
        return l + separator + operator.symbol() + separator + r;
    }

    @Override
    public String visitTernary(TernaryNode node) {
        return "IF (" + node.condition().accept(this) + ") THEN "
                + wrap(node.thenBranch(), node.thenBranch() instanceof TernaryNode)
                + " ELSE " + node.elseBranch().accept(this);
    }

    @Override
    public String visitFunction(FunctionNode node) {
        if (isPostfix(node)) {
            Node operand = node.argument();
            return wrap(operand, precedence(operand) < ATOM || isPostfix(operand)) + node.name();
        }
        return node.name() + node.arguments().stream()
                .map(argument -> argument.accept(this))
                .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String visitPlaceholder(Node placeholder) {
        if (placeholder instanceof PostfixNode postfix) {
            return postfix.symbol();
        }
        if (placeholder instanceof CloseParenthesisNode) {
            return ")";
        }
        if (placeholder instanceof CloseBraceNode) {
            return "}";
        }
        throw new IllegalArgumentException("Not a placeholder: " + placeholder);
    }

    private String wrap(Node node, boolean parenthesize) {
        String text = node.accept(this);
        return parenthesize ? "(" + text + ")" : text;
    }

    static boolean isPostfix(Node node) {
        return node instanceof FunctionNode f && (f.name().equals("!") || f.name().equals("!!"));
    }

    /**
     * Binding strength of the printed form of a node.
     */
    static int precedence(Node node) {
        if (node instanceof InfixNode infix) {
            if (infix.isUnary()) {
                return infix.operator() == Operator.NOT ? Operator.NOT.precedence() : PREFIX_MINUS;
            }
            return infix.operator().precedence();
        }
        if (node instanceof TernaryNode) {
            return CONDITIONAL;
        }
        if (node instanceof IntegerNode i) {
            return i.value() < 0 ? PREFIX_MINUS : ATOM;
        }
        if (node instanceof FloatNode f) {
            return f.value() < 0 ? PREFIX_MINUS : ATOM;
        }
        if (node instanceof RationalNode r) {
            return r.numerator() < 0 ? PREFIX_MINUS : Operator.DIVIDE.precedence();
        }
        return ATOM;
    }
}
