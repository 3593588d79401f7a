package org.finos.legend.math.parser;

import org.eclipse.collections.api.factory.Stacks;
import org.eclipse.collections.api.stack.MutableStack;
import org.finos.legend.math.ast.BooleanNode;
import org.finos.legend.math.ast.ConstantNode;
import org.finos.legend.math.ast.FloatNode;
import org.finos.legend.math.ast.FunctionNode;
import org.finos.legend.math.ast.InfixNode;
import org.finos.legend.math.ast.IntegerNode;
import org.finos.legend.math.ast.Node;
import org.finos.legend.math.ast.Operator;
import org.finos.legend.math.ast.RationalNode;
import org.finos.legend.math.ast.StringNode;
import org.finos.legend.math.ast.TernaryNode;
import org.finos.legend.math.ast.VariableNode;
import org.finos.legend.math.error.DelimiterMismatchException;
import org.finos.legend.math.error.SyntaxErrorException;
import org.finos.legend.math.error.UnexpectedOperatorException;
import org.finos.legend.math.lexer.Token;
import org.finos.legend.math.lexer.TokenType;
import org.finos.legend.math.number.Rational;
import org.finos.legend.math.simplify.OperationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Operator-precedence (shunting-yard) parser turning a token list into an expression tree.
 *
 * Handles:
 * - Binary operators by precedence and associativity: 2^3^2 is 2^(3^2), 8/4/2 is (8/4)/2
 * - Prefix minus and NOT, postfix factorials
 * - Function calls, including the two-argument ending(value, tail)
 * - Parenthesis and brace groups
 * - Conditionals: IF (c) THEN a ELSE b, and if (c) { return a; } else { return b; }
 *
 * Parse state lives in a per-call object, so one parser can be shared between threads.
 */
public final class Parser {

    private static final Logger LOGGER = LoggerFactory.getLogger(Parser.class);

    // Tokens after which + and - are prefix operators
    private static final Set<TokenType> UNARY_CONTEXT = EnumSet.of(
            TokenType.NOT, TokenType.OPEN_PARENTHESIS, TokenType.OPEN_BRACE, TokenType.TERMINATOR,
            TokenType.THEN, TokenType.ELSE, TokenType.RETURN, TokenType.IF);

    // Tokens that complete an operand
    private static final Set<TokenType> OPERAND_END = EnumSet.of(
            TokenType.NATURAL_NUMBER, TokenType.INTEGER, TokenType.RATIONAL_NUMBER, TokenType.REAL_NUMBER,
            TokenType.BOOLEAN, TokenType.VARIABLE, TokenType.CONSTANT, TokenType.STRING,
            TokenType.CLOSE_PARENTHESIS, TokenType.CLOSE_BRACE,
            TokenType.FACTORIAL_OPERATOR, TokenType.SEMI_FACTORIAL_OPERATOR);

    private final ParserOptions options;
    private final OperationBuilder builder = new OperationBuilder();

    public Parser() {
        this(ParserOptions.defaults());
    }

    public Parser(ParserOptions options) {
        this.options = options;
    }

    public ParserOptions getOptions() {
        return options;
    }

    /**
     * Parses a token list into the root node of the expression tree.
     *
     * @throws SyntaxErrorException        if the tokens do not form exactly one expression
     * @throws DelimiterMismatchException  if parentheses or braces do not match
     * @throws UnexpectedOperatorException if an operator appears where an operand is required
     */
    public Node parse(List<Token> tokens) {
        return parseWithTrace(tokens).root();
    }

    /**
     * Parses a token list, also returning the stack snapshots recorded when debugging is enabled.
     */
    public ParseResult parseWithTrace(List<Token> tokens) {
        List<Token> significant = prepare(tokens);
        if (significant.isEmpty()) {
            throw new SyntaxErrorException("Empty expression");
        }

        ParseState state = new ParseState();
        for (int i = 0; i < significant.size(); i++) {
            Token token = significant.get(i);
            if (token.type() == TokenType.FUNCTION_NAME) {
                Token next = i + 1 < significant.size() ? significant.get(i + 1) : null;
                if (next == null || next.type() != TokenType.OPEN_PARENTHESIS) {
                    throw new SyntaxErrorException("Expected '(' after function '" + token.value() + "'");
                }
                state.operators.push(PendingOperator.function(token.value(), state.operands.size(), token));
                i++;
                state.previous = next;
            } else {
                consume(state, token);
                state.previous = token;
            }
            if (options.debug()) {
                state.record(token);
            }
        }

        Node root = finish(state);
        if (options.debug()) {
            logSteps(significant, state.steps, root);
        }
        return new ParseResult(root, state.steps);
    }

    /**
     * Drops whitespace and inserts the "*" tokens of implicit multiplication.
     */
    private List<Token> prepare(List<Token> tokens) {
        List<Token> significant = new ArrayList<>();
        Token last = null;
        for (Token token : tokens) {
            if (token.type() == TokenType.WHITESPACE) {
                continue;
            }
            if (options.allowImplicitMultiplication() && Token.canFactorsInImplicitMultiplication(last, token)) {
                significant.add(Token.of(TokenType.MULTIPLICATION_OPERATOR, "*"));
            }
            significant.add(token);
            last = token;
        }
        return significant;
    }

    private void consume(ParseState state, Token token) {
        switch (token.type()) {
            case NATURAL_NUMBER, INTEGER -> state.operands.push(integer(token.value()));
            case RATIONAL_NUMBER -> state.operands.push(RationalNode.of(Rational.parse(token.value())));
            case REAL_NUMBER -> state.operands.push(FloatNode.of(Double.parseDouble(token.value())));
            case BOOLEAN -> state.operands.push(BooleanNode.of(token.value().equalsIgnoreCase("TRUE")));
            case VARIABLE -> state.operands.push(new VariableNode(stripSigil(token.value())));
            case CONSTANT -> state.operands.push(new ConstantNode(token.value()));
            case STRING -> state.operands.push(new StringNode(token.value()));
            case OPEN_PARENTHESIS -> state.operators.push(
                    PendingOperator.delimiter(PendingOperator.Kind.OPEN_PARENTHESIS, state.operands.size(), token));
            case OPEN_BRACE -> openBrace(state, token);
            case CLOSE_PARENTHESIS -> closeParenthesis(state, token);
            case CLOSE_BRACE -> closeGroup(state, token, PendingOperator.Kind.OPEN_BRACE);
            case FACTORIAL_OPERATOR, SEMI_FACTORIAL_OPERATOR -> postfix(state, token);
            case NOT -> state.operators.push(PendingOperator.prefix(Operator.NOT, token));
            case ADDITION_OPERATOR, SUBTRACTION_OPERATOR -> additive(state, token);
            case IF -> state.operators.push(PendingOperator.conditional(state.operands.size(), token));
            case THEN -> then(state, token);
            case ELSE -> otherwise(state, token);
            case TERMINATOR -> terminator(state);
            case RETURN -> {
                // return only decorates the branches of the brace form
            }
            default -> {
                if (!token.type().isInfixOperator()) {
                    throw new SyntaxErrorException("Unexpected token '" + token.value() + "'");
                }
                binary(state, token);
            }
        }
    }

    private static Node integer(String text) {
        try {
            return IntegerNode.of(Long.parseLong(text));
        } catch (NumberFormatException tooLarge) {
            return FloatNode.of(Double.parseDouble(text));
        }
    }

    private static String stripSigil(String name) {
        return name.startsWith("$") ? name.substring(1) : name;
    }

    private void additive(ParseState state, Token token) {
        if (!isUnaryPosition(state.previous)) {
            binary(state, token);
        } else if (token.type() == TokenType.SUBTRACTION_OPERATOR) {
            state.operators.push(PendingOperator.prefix(Operator.SUBTRACT, token));
        }
        // unary plus is dropped
    }

    private static boolean isUnaryPosition(Token previous) {
        return previous == null
                || previous.type().isInfixOperator()
                || UNARY_CONTEXT.contains(previous.type());
    }

    private void binary(ParseState state, Token token) {
        if (state.previous == null || !OPERAND_END.contains(state.previous.type())) {
            throw new UnexpectedOperatorException(token.value());
        }
        Operator operator = Operator.fromSymbol(token.value());
        while (state.operators.notEmpty() && state.operators.peek().bindsTighterThan(operator)) {
            reduce(state);
        }
        state.operators.push(PendingOperator.binary(operator, token));
    }

    private static void postfix(ParseState state, Token token) {
        Token previous = state.previous;
        if (previous != null && (previous.type().isInfixOperator() || previous.type() == TokenType.NOT)) {
            throw new UnexpectedOperatorException(token.value());
        }
        if (previous == null || !OPERAND_END.contains(previous.type()) || state.operands.isEmpty()) {
            throw new SyntaxErrorException("Postfix operator '" + token.value() + "' has no operand");
        }
        state.operands.push(FunctionNode.of(token.value(), state.operands.pop()));
    }

    private static void openBrace(ParseState state, Token token) {
        // if (c) { ... }: a brace right after the condition starts the then-branch
        if (state.operators.notEmpty()) {
            PendingOperator top = state.operators.peek();
            if (top.kind() == PendingOperator.Kind.CONDITIONAL && top.stage() == PendingOperator.Stage.CONDITION
                    && state.operands.size() - top.operandDepth() == 1) {
                top.advanceTo(PendingOperator.Stage.THEN);
            }
        }
        state.operators.push(PendingOperator.delimiter(PendingOperator.Kind.OPEN_BRACE, state.operands.size(), token));
    }

    private void closeParenthesis(ParseState state, Token token) {
        reduceWhile(state, top -> top.isOperator() || top.isCompleteConditional());
        if (state.operators.notEmpty() && state.operators.peek().kind() == PendingOperator.Kind.FUNCTION) {
            PendingOperator function = state.operators.pop();
            List<Node> arguments = popAbove(state, function.operandDepth());
            state.operands.push(new FunctionNode(function.functionName(), arguments));
            return;
        }
        closeGroup(state, token, PendingOperator.Kind.OPEN_PARENTHESIS);
    }

    private void closeGroup(ParseState state, Token token, PendingOperator.Kind opener) {
        reduceWhile(state, top -> top.isOperator() || top.isCompleteConditional());
        if (state.operators.isEmpty() || state.operators.peek().kind() != opener) {
            throw new DelimiterMismatchException(token.value());
        }
        PendingOperator group = state.operators.pop();
        int produced = state.operands.size() - group.operandDepth();
        if (produced != 1) {
            throw new SyntaxErrorException("Group closed by '" + token.value() + "' must contain one expression, found "
                    + produced);
        }
    }

    private void then(ParseState state, Token token) {
        reduceWhile(state, top -> top.isOperator() || top.isCompleteConditional());
        PendingOperator conditional = expectConditional(state, token, PendingOperator.Stage.CONDITION, 1);
        conditional.advanceTo(PendingOperator.Stage.THEN);
    }

    private void otherwise(ParseState state, Token token) {
        reduceWhile(state, top -> top.isOperator() || top.isCompleteConditional());
        PendingOperator conditional = expectConditional(state, token, PendingOperator.Stage.THEN, 2);
        conditional.advanceTo(PendingOperator.Stage.ELSE);
    }

    private static PendingOperator expectConditional(ParseState state, Token token, PendingOperator.Stage stage,
                                                     int operands) {
        if (state.operators.isEmpty()) {
            throw new SyntaxErrorException("'" + token.value() + "' without IF");
        }
        PendingOperator top = state.operators.peek();
        if (top.kind() != PendingOperator.Kind.CONDITIONAL || top.stage() != stage) {
            throw new SyntaxErrorException("Unexpected '" + token.value() + "'");
        }
        if (state.operands.size() - top.operandDepth() != operands) {
            throw new SyntaxErrorException("Malformed conditional before '" + token.value() + "'");
        }
        return top;
    }

    private void terminator(ParseState state) {
        // inside a call the terminator separates arguments, elsewhere it ends a statement
        reduceWhile(state, top -> top.isOperator());
    }

    private Node finish(ParseState state) {
        while (state.operators.notEmpty()) {
            PendingOperator top = state.operators.peek();
            if (top.isDelimiter()) {
                throw new DelimiterMismatchException(top.token().value());
            }
            if (top.kind() == PendingOperator.Kind.CONDITIONAL && !top.isCompleteConditional()) {
                throw new SyntaxErrorException("Incomplete conditional");
            }
            reduce(state);
        }
        if (state.operands.size() != 1) {
            throw new SyntaxErrorException("Expected a single expression, found " + state.operands.size());
        }
        return state.operands.pop();
    }

    private void reduceWhile(ParseState state, Predicate<PendingOperator> condition) {
        while (state.operators.notEmpty() && condition.test(state.operators.peek())) {
            reduce(state);
        }
    }

    /**
     * Pops the top operator and replaces its operands by the node it builds.
     */
    private void reduce(ParseState state) {
        PendingOperator pending = state.operators.pop();
        switch (pending.kind()) {
            case BINARY -> {
                if (state.operands.size() < 2) {
                    throw new SyntaxErrorException("Operator '" + pending.operator().symbol() + "' needs two operands");
                }
                Node right = state.operands.pop();
                Node left = state.operands.pop();
                state.operands.push(options.simplify()
                        ? builder.simplify(pending.operator(), left, right)
                        : InfixNode.of(pending.operator(), left, right));
            }
            case PREFIX -> {
                if (state.operands.isEmpty()) {
                    throw new SyntaxErrorException("Operator '" + pending.token().value() + "' has no operand");
                }
                Node operand = state.operands.pop();
                state.operands.push(options.simplify()
                        ? builder.simplify(pending.operator(), operand, null)
                        : InfixNode.unary(pending.operator(), operand));
            }
            case CONDITIONAL -> {
                if (state.operands.size() - pending.operandDepth() != 3) {
                    throw new SyntaxErrorException("Malformed conditional");
                }
                Node elseBranch = state.operands.pop();
                Node thenBranch = state.operands.pop();
                Node condition = state.operands.pop();
                state.operands.push(options.simplify()
                        ? builder.condition(condition, thenBranch, elseBranch)
                        : new TernaryNode(condition, thenBranch, elseBranch));
            }
            default -> throw new DelimiterMismatchException(pending.token().value());
        }
    }

    private static List<Node> popAbove(ParseState state, int depth) {
        List<Node> nodes = new ArrayList<>();
        while (state.operands.size() > depth) {
            nodes.add(state.operands.pop());
        }
        Collections.reverse(nodes);
        return nodes;
    }

    private static void logSteps(List<Token> tokens, List<ParseStep> steps, Node root) {
        if (!LOGGER.isDebugEnabled()) {
            return;
        }
        StringBuilder table = new StringBuilder();
        table.append(String.format("%-16s | %-40s | %s%n", "token", "operands", "operators"));
        for (ParseStep step : steps) {
            table.append(String.format("%-16s | %-40s | %s%n",
                    step.token().value(), String.join(" ", step.operands()), String.join(" ", step.operators())));
        }
        LOGGER.debug("Parsed {} tokens into {}\n{}", tokens.size(), root, table);
    }

    /**
     * Mutable state of a single parse.
     */
    private static final class ParseState {
        private final MutableStack<Node> operands = Stacks.mutable.empty();
        private final MutableStack<PendingOperator> operators = Stacks.mutable.empty();
        private final List<ParseStep> steps = new ArrayList<>();
        private Token previous;

        void record(Token token) {
            List<String> operandSnapshot = new ArrayList<>();
            operands.forEach(node -> operandSnapshot.add(String.valueOf(node)));
            Collections.reverse(operandSnapshot);
            List<String> operatorSnapshot = new ArrayList<>();
            operators.forEach(op -> operatorSnapshot.add(op.toString()));
            Collections.reverse(operatorSnapshot);
            steps.add(new ParseStep(token, operandSnapshot, operatorSnapshot));
        }
    }
}
