package org.finos.legend.math.print;

import org.finos.legend.math.ast.BooleanNode;
import org.finos.legend.math.ast.ConstantNode;
import org.finos.legend.math.ast.FloatNode;
import org.finos.legend.math.ast.FunctionNode;
import org.finos.legend.math.ast.InfixNode;
import org.finos.legend.math.ast.IntegerNode;
import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.Operator;
import org.finos.legend.math.ast.PrinterVisitor;
import org.finos.legend.math.ast.RationalNode;
import org.finos.legend.math.ast.StringNode;
import org.finos.legend.math.ast.TernaryNode;
import org.finos.legend.math.ast.VariableNode;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Prints a tree as LaTeX math.
 */
public final class LatexPrinter implements PrinterVisitor<String> {

    // functions LaTeX has a command for
    private static final Set<String> NAMED = Set.of(
            "sin", "cos", "tan", "cot", "sinh", "cosh", "tanh", "coth",
            "arcsin", "arccos", "arctan", "exp", "log", "ln", "lg", "arg");

    private final AsciiPrinter placeholders = new AsciiPrinter();

    public static String print(Node node) {
        return node.accept(new LatexPrinter());
    }

    @Override
    public String visitInteger(IntegerNode node) {
        return Long.toString(node.value());
    }

    @Override
    public String visitRational(RationalNode node) {
        String fraction = "\\frac{" + Math.abs(node.numerator()) + "}{" + node.denominator() + "}";
        return node.numerator() < 0 ? "-" + fraction : fraction;
    }

    @Override
    public String visitFloat(FloatNode node) {
        double value = node.value();
        if (Double.isNaN(value)) {
            return "\\mathrm{NaN}";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "\\infty" : "-\\infty";
        }
        return Double.toString(value);
    }

    @Override
    public String visitBoolean(BooleanNode node) {
        return "\\mathrm{" + node + "}";
    }

    @Override
    public String visitVariable(VariableNode node) {
        return node.name();
    }

    @Override
    public String visitConstant(ConstantNode node) {
        return switch (node.name()) {
            case "pi" -> "\\pi";
            case "NAN" -> "\\mathrm{NaN}";
            case "INF" -> "\\infty";
            default -> node.name();
        };
    }

    @Override
    public String visitString(StringNode node) {
        return "\\text{" + node.value() + "}";
    }

    @Override
    public String visitInfix(InfixNode node) {
        Operator operator = node.operator();
        if (node.isUnary()) {
            String prefix = operator == Operator.NOT ? "\\lnot " : "-";
            return prefix + wrap(node.left(), AsciiPrinter.precedence(node.left()) <= Operator.SUBTRACT.precedence());
        }
        if (operator == Operator.DIVIDE) {
            return "\\frac{" + node.left().accept(this) + "}{" + node.right().accept(this) + "}";
        }
        int own = operator.precedence();
        int left = AsciiPrinter.precedence(node.left());
        int right = AsciiPrinter.precedence(node.right());
        if (operator == Operator.POWER) {
            return wrap(node.left(), left <= own) + "^{" + node.right().accept(this) + "}";
        }
        String l = wrap(node.left(), left < own);
        String r = wrap(node.right(), right < own || right == own && operator == Operator.SUBTRACT);
        return l + symbol(operator) + r;
    }

    private static String symbol(Operator operator) {
        return switch (operator) {
            case MULTIPLY -> " \\cdot ";
            case NOT_EQUAL -> " \\neq ";
            case GREATER_OR_EQUAL -> " \\geq ";
            case LESS_OR_EQUAL -> " \\leq ";
            case AND -> " \\land ";
            case OR -> " \\lor ";
            default -> " " + operator.symbol() + " ";
        };
    }

    @Override
    public String visitTernary(TernaryNode node) {
        return "\\begin{cases} " + node.thenBranch().accept(this) + " & \\text{if } " + node.condition().accept(this)
                + " \\\\ " + node.elseBranch().accept(this) + " & \\text{otherwise} \\end{cases}";
    }

    @Override
    public String visitFunction(FunctionNode node) {
        String name = node.name();
        if (AsciiPrinter.isPostfix(node)) {
            Node operand = node.argument();
            boolean atom = AsciiPrinter.precedence(operand) == AsciiPrinter.ATOM && !AsciiPrinter.isPostfix(operand);
            return wrap(operand, !atom) + name;
        }
        String arguments = node.arguments().stream()
                .map(argument -> argument.accept(this))
                .collect(Collectors.joining(", "));
        return switch (name) {
            case "sqrt" -> "\\sqrt{" + arguments + "}";
            case "abs" -> "\\left|" + arguments + "\\right|";
            case "floor" -> "\\lfloor " + arguments + " \\rfloor";
            case "ceil" -> "\\lceil " + arguments + " \\rceil";
            default -> (NAMED.contains(name) ? "\\" + name : "\\operatorname{" + name + "}")
                    + "\\left(" + arguments + "\\right)";
        };
    }

    @Override
    public String visitPlaceholder(Node placeholder) {
        return placeholders.visitPlaceholder(placeholder);
    }

    private String wrap(Node node, boolean parenthesize) {
        String text = node.accept(this);
        return parenthesize ? "\\left(" + text + "\\right)" : text;
    }
}
