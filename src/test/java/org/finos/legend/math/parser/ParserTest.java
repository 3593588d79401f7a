package org.finos.legend.math.parser;

import org.finos.legend.math.ast.*;
import org.finos.legend.math.error.*;
import org.finos.legend.math.lexer.Lexer;
import org.finos.legend.math.lexer.Lexers;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser tests - token lists come from the real lexers, trees are compared structurally.
 */
@DisplayName("Parser Tests")
class ParserTest {

    private static final VariableNode X = new VariableNode("x");
    private static final VariableNode Y = new VariableNode("y");

    private static Node math(String text) {
        return new Parser().parse(Lexers.stdMath().tokenize(text));
    }

    private static Node math(String text, ParserOptions options) {
        return new Parser(options).parse(Lexers.stdMath().tokenize(text));
    }

    private static Node logic(String text) {
        return new Parser(ParserOptions.defaults().withImplicitMultiplication(false))
                .parse(Lexers.logic().tokenize(text));
    }

    private static Node raw(Lexer lexer, String text) {
        return new Parser(new ParserOptions(false, false, false)).parse(lexer.tokenize(text));
    }

    private static IntegerNode i(long value) {
        return IntegerNode.of(value);
    }

    // ==================== Precedence ====================

    @Nested
    @DisplayName("Precedence and associativity")
    class Precedence {

        @Test
        @DisplayName("Exponentiation is right associative: 2^3^2 = 512")
        void testPowerRightAssociative() {
            assertEquals(i(512), math("2^3^2"));
            assertEquals(InfixNode.of(Operator.POWER, i(2), InfixNode.of(Operator.POWER, i(3), i(2))),
                    raw(Lexers.stdMath(), "2^3^2"));
        }

        @Test
        @DisplayName("Division is left associative: 8/4/2 = 1")
        void testDivisionLeftAssociative() {
            assertEquals(new RationalNode(1, 1), math("8/4/2"));
            assertEquals(InfixNode.of(Operator.DIVIDE, InfixNode.of(Operator.DIVIDE, i(8), i(4)), i(2)),
                    raw(Lexers.stdMath(), "8/4/2"));
        }

        @Test
        @DisplayName("Products bind tighter than sums")
        void testProductBeforeSum() {
            Node tree = math("x+2*y");

            assertEquals(InfixNode.of(Operator.ADD, X, InfixNode.of(Operator.MULTIPLY, i(2), Y)), tree);
        }

        @Test
        @DisplayName("Parentheses override precedence")
        void testParentheses() {
            assertEquals(InfixNode.of(Operator.MULTIPLY, InfixNode.of(Operator.ADD, X, i(2)), Y), math("(x+2)*y"));
            assertEquals(i(20), math("(2+3)*4"));
        }

        @Test
        @DisplayName("Braces group like parentheses")
        void testBraces() {
            assertEquals(i(20), math("{2+3}*4"));
        }
    }

    // ==================== Unary operators ====================

    @Nested
    @DisplayName("Prefix and postfix operators")
    class UnaryOperators {

        @Test
        @DisplayName("Unary minus binds looser than power")
        void testMinusPower() {
            assertEquals(i(-4), math("-2^2"));
            assertEquals(i(4), math("(-2)^2"));
        }

        @Test
        @DisplayName("Unary minus after operators")
        void testMinusAfterOperator() {
            assertEquals(i(-6), math("2*-3"));
            assertEquals(InfixNode.of(Operator.POWER, i(2), i(-1)), math("2^-1"));
            assertEquals(InfixNode.of(Operator.ADD, InfixNode.unary(Operator.SUBTRACT, X), i(1)), math("-x+1"));
        }

        @Test
        @DisplayName("Unary plus is dropped")
        void testUnaryPlus() {
            assertEquals(X, math("+x"));
            assertEquals(i(5), math("2+(+3)"));
        }

        @Test
        @DisplayName("Double negation cancels")
        void testDoubleNegation() {
            assertEquals(X, math("-(-x)"));
        }

        @Test
        @DisplayName("Factorials wrap the preceding operand")
        void testFactorial() {
            assertEquals(FunctionNode.of("!", i(3)), math("3!"));
            assertEquals(FunctionNode.of("!!", i(5)), math("(2+3)!!"));
            assertEquals(InfixNode.of(Operator.POWER, i(2), FunctionNode.of("!", i(3))), math("2^3!"));
        }

        @Test
        @DisplayName("Factorial without operand")
        void testFactorialWithoutOperand() {
            assertThrows(SyntaxErrorException.class, () -> math("!3"));
        }

        @Test
        @DisplayName("Factorial right after an operator")
        void testFactorialAfterOperator() {
            UnexpectedOperatorException e = assertThrows(UnexpectedOperatorException.class, () -> math("2+!"));
            assertEquals("!", e.getOperator());
        }
    }

    // ==================== Implicit multiplication ====================

    @Nested
    @DisplayName("Implicit multiplication")
    class ImplicitMultiplication {

        @Test
        @DisplayName("2x is 2 * x")
        void testNumberVariable() {
            assertEquals(InfixNode.of(Operator.MULTIPLY, i(2), X), math("2x"));
        }

        @Test
        @DisplayName("Adjacent groups and functions")
        void testGroupsAndFunctions() {
            assertEquals(i(6), math("2(3)"));
            assertEquals(InfixNode.of(Operator.MULTIPLY, X, Y), math("(x)(y)"));
            assertEquals(InfixNode.of(Operator.MULTIPLY, i(2), FunctionNode.of("sin", X)), math("2sin(x)"));
        }

        @Test
        @DisplayName("Disabled implicit multiplication rejects 2x")
        void testDisabled() {
            assertThrows(SyntaxErrorException.class,
                    () -> math("2x", ParserOptions.defaults().withImplicitMultiplication(false)));
        }
    }

    // ==================== Functions ====================

    @Nested
    @DisplayName("Function calls")
    class Functions {

        @Test
        @DisplayName("Single argument")
        void testSingleArgument() {
            assertEquals(FunctionNode.of("sqrt", InfixNode.of(Operator.ADD, X, i(1))), math("sqrt(x+1)"));
        }

        @Test
        @DisplayName("Two arguments separated by a terminator")
        void testEnding() {
            Node tree = new Parser(ParserOptions.defaults().withImplicitMultiplication(false))
                    .parse(Lexers.pricing().tokenize("ending(price*2, .99)"));

            assertEquals(FunctionNode.of("ending",
                    InfixNode.of(Operator.MULTIPLY, new VariableNode("price"), i(2)), new StringNode(".99")), tree);
        }

        @Test
        @DisplayName("Wrong number of arguments")
        void testArity() {
            assertThrows(SyntaxErrorException.class, () -> math("sin()"));
            assertThrows(SyntaxErrorException.class, () -> math("sin(1, 2)"));
            assertThrows(SyntaxErrorException.class, () -> logic("ending(1)"));
        }

        @Test
        @DisplayName("Function name must be followed by a parenthesis")
        void testMissingParenthesis() {
            assertThrows(SyntaxErrorException.class, () -> math("sin"));
            assertThrows(SyntaxErrorException.class, () -> math("sin 2"));
        }
    }

    // ==================== Conditionals ====================

    @Nested
    @DisplayName("Conditionals")
    class Conditionals {

        @Test
        @DisplayName("IF THEN ELSE with a known condition folds")
        void testFoldedConditional() {
            assertEquals(i(0), logic("IF (2<1) THEN 1 ELSE 0"));
        }

        @Test
        @DisplayName("Brace form with return")
        void testBraceForm() {
            assertEquals(i(8), logic("if (3 < 2) { return 1+1; } else { return 2^3; }"));
            assertEquals(i(0), logic("IF (5>4) {0;} else {1;}"));
        }

        @Test
        @DisplayName("Unknown condition keeps a ternary node")
        void testSymbolicConditional() {
            Node tree = logic("IF (x > 1) THEN 10 ELSE -20");

            assertEquals(new TernaryNode(InfixNode.of(Operator.GREATER, X, i(1)), i(10), i(-20)), tree);
        }

        @Test
        @DisplayName("Raw conditional without simplification")
        void testRawConditional() {
            Node tree = raw(Lexers.logic(), "IF (2<1) THEN 1 ELSE 0");

            assertEquals(new TernaryNode(InfixNode.of(Operator.LESS, i(2), i(1)), i(1), i(0)), tree);
        }

        @Test
        @DisplayName("Nested conditionals in either branch")
        void testNested() {
            VariableNode a = new VariableNode("a");
            VariableNode b = new VariableNode("b");

            assertEquals(new TernaryNode(a, i(1), new TernaryNode(b, i(2), i(3))),
                    logic("IF (a) THEN 1 ELSE IF (b) THEN 2 ELSE 3"));
            assertEquals(new TernaryNode(a, new TernaryNode(b, i(1), i(2)), i(3)),
                    logic("IF (a) THEN IF (b) THEN 1 ELSE 2 ELSE 3"));
        }

        @Test
        @DisplayName("Misplaced keywords")
        void testMisplacedKeywords() {
            assertThrows(SyntaxErrorException.class, () -> logic("THEN 1"));
            assertThrows(SyntaxErrorException.class, () -> logic("IF (a) THEN 1"));
            assertThrows(SyntaxErrorException.class, () -> logic("IF (a) ELSE 1"));
        }

        @Test
        @DisplayName("Logical operator precedence")
        void testLogicalPrecedence() {
            VariableNode a = new VariableNode("a");
            VariableNode b = new VariableNode("b");
            VariableNode c = new VariableNode("c");

            assertEquals(InfixNode.of(Operator.AND, InfixNode.unary(Operator.NOT, a), b), logic("NOT a && b"));
            assertEquals(InfixNode.of(Operator.OR, InfixNode.of(Operator.AND, a, b), c), logic("a AND b OR c"));
            assertEquals(InfixNode.of(Operator.AND,
                            InfixNode.of(Operator.GREATER, a, i(-1)), InfixNode.of(Operator.LESS_OR_EQUAL, b, c)),
                    logic("a > -1 && b <= c"));
        }

        @Test
        @DisplayName("Dollar sigil is stripped from variable names")
        void testSigil() {
            assertEquals(InfixNode.of(Operator.MULTIPLY, new VariableNode("price"), i(2)), logic("$price * 2"));
        }
    }

    // ==================== Errors ====================

    @Nested
    @DisplayName("Malformed input")
    class Errors {

        @Test
        @DisplayName("Unclosed parenthesis")
        void testUnclosed() {
            DelimiterMismatchException e = assertThrows(DelimiterMismatchException.class, () -> math("(x+y"));
            assertEquals("(", e.getDelimiter());
        }

        @Test
        @DisplayName("Unopened or mismatched delimiters")
        void testMismatched() {
            assertEquals(")", assertThrows(DelimiterMismatchException.class, () -> math("x+y)")).getDelimiter());
            assertEquals("}", assertThrows(DelimiterMismatchException.class, () -> math("(x+y}")).getDelimiter());
            assertThrows(DelimiterMismatchException.class, () -> math("sin(x}"));
        }

        @Test
        @DisplayName("Empty input and empty groups")
        void testEmpty() {
            assertThrows(SyntaxErrorException.class, () -> math(""));
            assertThrows(SyntaxErrorException.class, () -> math("   "));
            assertThrows(SyntaxErrorException.class, () -> math("()"));
        }

        @Test
        @DisplayName("Missing or doubled operators")
        void testOperators() {
            assertThrows(SyntaxErrorException.class, () -> math("2+"));
            assertThrows(UnexpectedOperatorException.class, () -> math("2 * / 3"));
            assertThrows(UnexpectedOperatorException.class, () -> math("*2"));
        }

        @Test
        @DisplayName("Two expressions without operator")
        void testTwoExpressions() {
            assertThrows(SyntaxErrorException.class, () -> math("1;2"));
        }

        @Test
        @DisplayName("Literal division by zero is found while parsing")
        void testDivisionByZero() {
            assertThrows(DivisionByZeroException.class, () -> math("1/0"));
            assertThrows(DivisionByZeroException.class, () -> math("0/0"));
            assertThrows(ExponentialException.class, () -> math("0^0"));
        }

        @Test
        @DisplayName("Without simplification division by zero is left to evaluation")
        void testDivisionByZeroRaw() {
            assertEquals(InfixNode.of(Operator.DIVIDE, i(1), i(0)), raw(Lexers.stdMath(), "1/0"));
        }
    }

    // ==================== Trace ====================

    @Nested
    @DisplayName("Debug trace")
    class Trace {

        @Test
        @DisplayName("One step per token with both stacks")
        void testTrace() {
            Parser parser = new Parser(ParserOptions.defaults().withDebug(true));

            ParseResult result = parser.parseWithTrace(Lexers.stdMath().tokenize("1 + 2"));

            assertEquals(i(3), result.root());
            assertEquals(3, result.steps().size());
            ParseStep last = result.steps().get(2);
            assertEquals("2", last.token().value());
            assertEquals(List.of("1", "2"), last.operands());
            assertEquals(List.of("+"), last.operators());
        }

        @Test
        @DisplayName("No trace unless debugging")
        void testNoTrace() {
            ParseResult result = new Parser().parseWithTrace(Lexers.stdMath().tokenize("1 + 2"));

            assertTrue(result.steps().isEmpty());
            assertEquals(i(3), result.root());
        }
    }

    @Test
    @DisplayName("A parser can be shared between threads")
    void testSharedParser() {
        Parser parser = new Parser();
        Lexer lexer = Lexers.stdMath();

        List<Node> trees = IntStream.range(0, 200).parallel()
                .mapToObj(n -> parser.parse(lexer.tokenize(n + "x+" + n)))
                .toList();

        for (int n = 0; n < trees.size(); n++) {
            Node expected = n == 0 ? i(0) : InfixNode.of(Operator.ADD,
                    n == 1 ? X : InfixNode.of(Operator.MULTIPLY, i(n), X), i(n));
            assertEquals(expected, trees.get(n));
        }
    }
}
