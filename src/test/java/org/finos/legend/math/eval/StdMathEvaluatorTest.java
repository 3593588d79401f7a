package org.finos.legend.math.eval;

import org.finos.legend.math.ast.*;
import org.finos.legend.math.error.*;
import org.finos.legend.math.lexer.Lexers;
import org.finos.legend.math.parser.Parser;
import org.finos.legend.math.parser.ParserOptions;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StdMathEvaluator Tests")
class StdMathEvaluatorTest {

    private static final double DELTA = 1e-9;

    // simplification is off so that the evaluator sees every operator
    private static final Parser PARSER = new Parser(ParserOptions.defaults().withSimplify(false));

    private static double eval(String text) {
        return eval(text, Map.of());
    }

    private static double eval(String text, Map<String, ? extends Number> bindings) {
        return PARSER.parse(Lexers.stdMath().tokenize(text)).accept(new StdMathEvaluator(bindings));
    }

    // ==================== Arithmetic ====================

    @Test
    @DisplayName("Operators follow precedence")
    void testArithmetic() {
        assertEquals(14.0, eval("2+3*4"));
        assertEquals(512.0, eval("2^3^2"));
        assertEquals(1.0, eval("8/4/2"));
        assertEquals(-4.0, eval("-2^2"));
        assertEquals(0.25, eval("2^-2"));
    }

    @Test
    @DisplayName("Variables are looked up in the bindings")
    void testVariables() {
        assertEquals(5.0, eval("x^2+1", Map.of("x", 2)));
        assertEquals(7.5, eval("2x+y", Map.of("x", 3, "y", 1.5)));
    }

    @Test
    @DisplayName("Unbound variable")
    void testUnboundVariable() {
        UnknownVariableException e = assertThrows(UnknownVariableException.class, () -> eval("x+y", Map.of("x", 1)));
        assertEquals("y", e.getVariable());
    }

    @Test
    @DisplayName("Constants")
    void testConstants() {
        assertEquals(Math.PI, eval("pi"), DELTA);
        assertEquals(2 * Math.E, eval("2e"), DELTA);
        assertTrue(Double.isNaN(eval("NAN")));
        assertEquals(Double.POSITIVE_INFINITY, eval("INF"));
        assertThrows(UnknownConstantException.class, () -> new ConstantNode("tau").accept(new StdMathEvaluator()));
    }

    // ==================== Functions ====================

    @Nested
    @DisplayName("Functions")
    class Functions {

        @Test
        @DisplayName("Trigonometric and logarithmic functions")
        void testTranscendental() {
            assertEquals(0.0, eval("sin(0)"), DELTA);
            assertEquals(1.0, eval("sind(90)"), DELTA);
            assertEquals(Math.PI / 4, eval("arctan(1)"), DELTA);
            assertEquals(3.0, eval("lg(1000)"), DELTA);
            assertEquals(1.0, eval("ln(e)"), DELTA);
            assertEquals(4.0, eval("sqrt(16)"), DELTA);
        }

        @Test
        @DisplayName("Factorials")
        void testFactorials() {
            assertEquals(120.0, eval("5!"), DELTA);
            assertEquals(15.0, eval("5!!"), DELTA);
        }

        @Test
        @DisplayName("Rounding is half away from zero")
        void testRounding() {
            assertEquals(3.0, eval("round(2.5)"));
            assertEquals(-3.0, eval("round(-2.5)"));
            assertEquals(2.0, eval("floor(2.7)"));
            assertEquals(3.0, eval("ceil(2.1)"));
        }

        @Test
        @DisplayName("Logarithm of zero")
        void testLogOfZero() {
            assertThrows(LogarithmOfZeroException.class, () -> eval("ln(0)"));
            assertThrows(LogarithmOfZeroException.class, () -> eval("lg(x)", Map.of("x", 0)));
        }

        @Test
        @DisplayName("Unknown function")
        void testUnknownFunction() {
            FunctionNode node = new FunctionNode("foo", List.of(IntegerNode.of(1)));

            UnknownFunctionException e = assertThrows(UnknownFunctionException.class,
                    () -> node.accept(new StdMathEvaluator()));
            assertEquals("foo", e.getFunction());
        }
    }

    // ==================== Errors ====================

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Division by zero and zero to the zero")
        void testZero() {
            assertThrows(DivisionByZeroException.class, () -> eval("1/0"));
            assertThrows(DivisionByZeroException.class, () -> eval("1/(x-1)", Map.of("x", 1)));
            assertThrows(ExponentialException.class, () -> eval("0^0"));
        }

        @Test
        @DisplayName("Booleans and conditionals are not arithmetic")
        void testNonArithmetic() {
            StdMathEvaluator evaluator = new StdMathEvaluator();

            assertThrows(SyntaxErrorException.class, () -> BooleanNode.TRUE.accept(evaluator));
            assertThrows(SyntaxErrorException.class,
                    () -> new TernaryNode(BooleanNode.TRUE, IntegerNode.of(1), IntegerNode.of(2)).accept(evaluator));
        }

        @Test
        @DisplayName("Relational operators are unknown to arithmetic")
        void testRelational() {
            InfixNode node = InfixNode.of(Operator.LESS, IntegerNode.of(1), IntegerNode.of(2));

            assertThrows(UnknownOperatorException.class, () -> node.accept(new StdMathEvaluator()));
        }

        @Test
        @DisplayName("Missing operand")
        void testMissingOperand() {
            InfixNode node = new InfixNode(Operator.ADD, null, IntegerNode.of(1));

            NullOperandException e = assertThrows(NullOperandException.class, () -> node.accept(new StdMathEvaluator()));
            assertEquals("+", e.getOperator());
        }

        @Test
        @DisplayName("Strings must hold numbers")
        void testStrings() {
            assertEquals(2.5, new StringNode("2.5").accept(new StdMathEvaluator()));
            assertThrows(UnexpectedValueException.class, () -> new StringNode("abc").accept(new StdMathEvaluator()));
        }
    }
}
