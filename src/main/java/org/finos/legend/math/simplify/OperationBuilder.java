package org.finos.legend.math.simplify;

import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.Operator;
import org.finos.legend.math.error.NullOperandException;
import org.finos.legend.math.error.UnknownOperatorException;

/**
 * Creates operator nodes while folding what can be decided without bindings.
 *
 * Every method is pure. The only exceptions raised are DivisionByZeroException (literal zero divisor),
 * ExponentialException (literal 0^0), UnknownOperatorException and NullOperandException.
 */
public final class OperationBuilder {

    private final AdditionOperation addition = new AdditionOperation();
    private final SubtractionOperation subtraction = new SubtractionOperation();
    private final MultiplicationOperation multiplication = new MultiplicationOperation();
    private final DivisionOperation division = new DivisionOperation();
    private final ExponentiationOperation exponentiation = new ExponentiationOperation(multiplication);
    private final RelationalOperation relation = new RelationalOperation();
    private final ConjunctionOperation conjunction = new ConjunctionOperation();
    private final DisjunctionOperation disjunction = new DisjunctionOperation();
    private final NegationOperation negation = new NegationOperation();
    private final ConditionOperation condition = new ConditionOperation(relation);

    public Node addition(Node left, Node right) {
        return addition.make(left, right);
    }

    public Node subtraction(Node left, Node right) {
        return subtraction.make(left, right);
    }

    public Node unaryMinus(Node operand) {
        return subtraction.negate(operand);
    }

    public Node multiplication(Node left, Node right) {
        return multiplication.make(left, right);
    }

    public Node division(Node left, Node right) {
        return division.make(left, right);
    }

    public Node exponentiation(Node base, Node exponent) {
        return exponentiation.make(base, exponent);
    }

    public Node relation(Operator operator, Node left, Node right) {
        return relation.make(operator, left, right);
    }

    public Node conjunction(Node left, Node right) {
        return conjunction.make(left, right);
    }

    public Node disjunction(Node left, Node right) {
        return disjunction.make(left, right);
    }

    public Node negation(Node operand) {
        return negation.make(operand);
    }

    public Node condition(Node condition, Node thenBranch, Node elseBranch) {
        return this.condition.make(condition, thenBranch, elseBranch);
    }

    /**
     * Builds the node for an operator. A null right operand means the prefix form, which only
     * subtraction (unary minus) and NOT have.
     *
     * @throws NullOperandException if a required operand is missing
     */
    public Node simplify(Operator operator, Node left, Node right) {
        if (left == null) {
            throw new NullOperandException(operator.symbol());
        }
        if (right == null) {
            return switch (operator) {
                case SUBTRACT -> unaryMinus(left);
                case NOT -> negation(left);
                default -> throw new NullOperandException(operator.symbol());
            };
        }
        return switch (operator) {
            case ADD -> addition(left, right);
            case SUBTRACT -> subtraction(left, right);
            case MULTIPLY -> multiplication(left, right);
            case DIVIDE -> division(left, right);
            case POWER -> exponentiation(left, right);
            case AND -> conjunction(left, right);
            case OR -> disjunction(left, right);
            case NOT -> throw new UnknownOperatorException(operator.symbol());
            default -> relation(operator, left, right);
        };
    }
}
