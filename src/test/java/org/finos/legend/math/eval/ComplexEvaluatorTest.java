package org.finos.legend.math.eval;

import org.finos.legend.math.ast.*;
import org.finos.legend.math.error.*;
import org.finos.legend.math.lexer.Lexers;
import org.finos.legend.math.number.Complex;
import org.finos.legend.math.parser.Parser;
import org.finos.legend.math.parser.ParserOptions;
import org.junit.jupiter.api.*;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ComplexEvaluator Tests")
class ComplexEvaluatorTest {

    private static final double DELTA = 1e-9;

    private static final Parser PARSER = new Parser(ParserOptions.defaults().withSimplify(false));

    private static Complex eval(String text) {
        return eval(text, Map.of());
    }

    private static Complex eval(String text, Map<String, ?> bindings) {
        return PARSER.parse(Lexers.complexMath().tokenize(text)).accept(new ComplexEvaluator(bindings));
    }

    private static void assertComplex(double re, double im, Complex actual) {
        assertEquals(re, actual.re(), DELTA, () -> "real part of " + actual);
        assertEquals(im, actual.im(), DELTA, () -> "imaginary part of " + actual);
    }

    // ==================== Arithmetic ====================

    @Test
    @DisplayName("i squared is -1")
    void testImaginaryUnit() {
        assertComplex(-1, 0, eval("i*i"));
        assertComplex(-1, 0, eval("i^2"));
    }

    @Test
    @DisplayName("Products and quotients")
    void testArithmetic() {
        assertComplex(5, 5, eval("(1+2i)(3-i)"));
        assertComplex(0.56, -0.08, eval("(1+i)/(3+4i)*2"));
    }

    @Test
    @DisplayName("Euler's identity")
    void testEuler() {
        assertComplex(-1, 0, eval("e^(i*pi)"));
    }

    @Test
    @DisplayName("Real numbers are promoted")
    void testPromotion() {
        assertComplex(2.5, 0, eval("5/2"));
        assertComplex(0, 2, eval("sqrt(-4)"));
    }

    // ==================== Functions ====================

    @Nested
    @DisplayName("Functions")
    class Functions {

        @Test
        @DisplayName("Parts of a complex number")
        void testParts() {
            assertComplex(5, 0, eval("abs(3+4i)"));
            assertComplex(Math.PI / 2, 0, eval("arg(i)"));
            assertComplex(3, 0, eval("re(3+4i)"));
            assertComplex(4, 0, eval("im(3+4i)"));
            assertComplex(3, -4, eval("conj(3+4i)"));
            assertComplex(0.6, 0.8, eval("sgn(3+4i)"));
        }

        @Test
        @DisplayName("Logarithms")
        void testLogarithms() {
            assertComplex(0, Math.PI, eval("log(0-1)"));
            assertComplex(1, 0, eval("ln(e)"));
            assertThrows(LogarithmOfZeroException.class, () -> eval("ln(0)"));
            assertThrows(LogarithmOfZeroException.class, () -> eval("log(0)"));
            assertThrows(UnexpectedValueException.class, () -> eval("ln(-1)"));
        }

        @Test
        @DisplayName("Real-only functions")
        void testRealOnly() {
            assertComplex(6, 0, eval("3!"));
            assertComplex(3, 0, eval("round(2.5)"));
            assertThrows(UnexpectedValueException.class, () -> eval("i!"));
            assertThrows(UnexpectedValueException.class, () -> eval("floor(1+i)"));
        }
    }

    // ==================== Bindings and errors ====================

    @Test
    @DisplayName("Bindings accept complex numbers, reals and strings")
    void testBindings() {
        Map<String, Object> bindings = Map.of("z", "3+4i", "w", Complex.I, "x", 2);

        assertComplex(-2, 3, eval("z*w+x", bindings));
        assertThrows(UnknownVariableException.class, () -> eval("y", bindings));
        assertThrows(UnexpectedValueException.class, () -> eval("x", Map.of("x", Boolean.TRUE)));
    }

    @Test
    @DisplayName("Division by zero and zero to the zero")
    void testZero() {
        assertThrows(DivisionByZeroException.class, () -> eval("1/0"));
        assertThrows(DivisionByZeroException.class, () -> eval("i/(i-i)"));
        assertThrows(ExponentialException.class, () -> eval("0^0"));
    }

    @Test
    @DisplayName("Booleans and conditionals are not complex values")
    void testNonArithmetic() {
        ComplexEvaluator evaluator = new ComplexEvaluator();

        assertThrows(SyntaxErrorException.class, () -> BooleanNode.TRUE.accept(evaluator));
        assertThrows(SyntaxErrorException.class,
                () -> new TernaryNode(BooleanNode.TRUE, IntegerNode.of(1), IntegerNode.of(2)).accept(evaluator));
    }
}
