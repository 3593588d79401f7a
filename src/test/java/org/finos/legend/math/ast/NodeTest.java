package org.finos.legend.math.ast;

import org.finos.legend.math.error.DivisionByZeroException;
import org.finos.legend.math.error.SyntaxErrorException;
import org.finos.legend.math.error.UnknownOperatorException;
import org.finos.legend.math.eval.StdMathEvaluator;
import org.finos.legend.math.print.AsciiPrinter;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AST Node Tests")
class NodeTest {

    /**
     * Records which visit method each node dispatched to.
     */
    private static class RecordingVisitor implements NodeVisitor<String> {
        private final List<String> calls = new ArrayList<>();

        private String record(String call) {
            calls.add(call);
            return call;
        }

        @Override
        public String visitInteger(IntegerNode node) {
            return record("integer");
        }

        @Override
        public String visitRational(RationalNode node) {
            return record("rational");
        }

        @Override
        public String visitFloat(FloatNode node) {
            return record("float");
        }

        @Override
        public String visitBoolean(BooleanNode node) {
            return record("boolean");
        }

        @Override
        public String visitVariable(VariableNode node) {
            return record("variable");
        }

        @Override
        public String visitConstant(ConstantNode node) {
            return record("constant");
        }

        @Override
        public String visitString(StringNode node) {
            return record("string");
        }

        @Override
        public String visitInfix(InfixNode node) {
            return record("infix");
        }

        @Override
        public String visitTernary(TernaryNode node) {
            return record("ternary");
        }

        @Override
        public String visitFunction(FunctionNode node) {
            return record("function");
        }
    }

    // ==================== Dispatch ====================

    @Test
    @DisplayName("Each node calls exactly one visitor method")
    void testDispatch() {
        RecordingVisitor visitor = new RecordingVisitor();

        assertEquals("integer", IntegerNode.of(1).accept(visitor));
        assertEquals("rational", new RationalNode(1, 2).accept(visitor));
        assertEquals("float", FloatNode.of(1.5).accept(visitor));
        assertEquals("boolean", BooleanNode.TRUE.accept(visitor));
        assertEquals("variable", new VariableNode("x").accept(visitor));
        assertEquals("constant", new ConstantNode("pi").accept(visitor));
        assertEquals("string", new StringNode(".99").accept(visitor));
        assertEquals("function", FunctionNode.of("sin", IntegerNode.of(0)).accept(visitor));
        assertEquals("ternary",
                new TernaryNode(BooleanNode.TRUE, IntegerNode.of(1), IntegerNode.of(2)).accept(visitor));
        assertEquals(9, visitor.calls.size());
    }

    @Test
    @DisplayName("Relational and boolean operators reach visitInfix through the default visitLogicalInfix")
    void testLogicalInfixDefault() {
        RecordingVisitor visitor = new RecordingVisitor();

        InfixNode comparison = InfixNode.of(Operator.LESS, new VariableNode("x"), IntegerNode.of(1));
        InfixNode conjunction = InfixNode.of(Operator.AND, BooleanNode.TRUE, BooleanNode.FALSE);

        assertEquals("infix", comparison.accept(visitor));
        assertEquals("infix", conjunction.accept(visitor));
        assertEquals(List.of("infix", "infix"), visitor.calls);
    }

    @Test
    @DisplayName("Logic-aware visitors see logical operators separately")
    void testLogicalInfixOverride() {
        RecordingVisitor visitor = new RecordingVisitor() {
            @Override
            public String visitLogicalInfix(InfixNode node) {
                return "logical";
            }
        };

        assertEquals("logical", InfixNode.unary(Operator.NOT, BooleanNode.TRUE).accept(visitor));
        assertEquals("infix", InfixNode.of(Operator.ADD, IntegerNode.of(1), IntegerNode.of(2)).accept(visitor));
    }

    @Test
    @DisplayName("Placeholders reject non-printing visitors")
    void testPlaceholders() {
        StdMathEvaluator evaluator = new StdMathEvaluator();

        assertThrows(SyntaxErrorException.class, () -> new PostfixNode("!").accept(evaluator));
        assertThrows(SyntaxErrorException.class, () -> new CloseParenthesisNode().accept(evaluator));
        assertThrows(SyntaxErrorException.class, () -> new CloseBraceNode().accept(evaluator));

        assertEquals("!!", new PostfixNode("!!").accept(new AsciiPrinter()));
        assertEquals(")", new CloseParenthesisNode().accept(new AsciiPrinter()));
        assertEquals("}", new CloseBraceNode().accept(new AsciiPrinter()));
    }

    // ==================== Construction rules ====================

    @Nested
    @DisplayName("Rational nodes")
    class RationalNodes {

        @Test
        @DisplayName("Normalized on construction")
        void testNormalized() {
            RationalNode node = new RationalNode(6, -4);

            assertEquals(-3, node.numerator());
            assertEquals(2, node.denominator());
            assertEquals(-1.5, node.value());
            assertEquals(new RationalNode(-3, 2), node);
        }

        @Test
        @DisplayName("Zero denominator is a division by zero")
        void testZeroDenominator() {
            assertThrows(DivisionByZeroException.class, () -> new RationalNode(1, 0));
        }

        @Test
        @DisplayName("Zero numerator normalizes to 0/1")
        void testZero() {
            assertEquals(new RationalNode(0, 1), new RationalNode(0, -7));
        }
    }

    @Test
    @DisplayName("Function arity is checked on construction")
    void testFunctionArity() {
        assertThrows(SyntaxErrorException.class, () -> FunctionNode.of("sin"));
        assertThrows(SyntaxErrorException.class, () -> FunctionNode.of("sin", IntegerNode.of(1), IntegerNode.of(2)));
        assertThrows(SyntaxErrorException.class, () -> FunctionNode.of("ending", IntegerNode.of(1)));

        FunctionNode ending = FunctionNode.of("ending", new VariableNode("p"), new StringNode(".99"));
        assertEquals(2, ending.arity());
    }

    @Test
    @DisplayName("Structural equality")
    void testStructuralEquality() {
        Node a = InfixNode.of(Operator.MULTIPLY, IntegerNode.of(2), new VariableNode("x"));
        Node b = InfixNode.of(Operator.MULTIPLY, IntegerNode.of(2), new VariableNode("x"));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, InfixNode.of(Operator.MULTIPLY, new VariableNode("x"), IntegerNode.of(2)));
    }

    // ==================== Operators ====================

    @Test
    @DisplayName("Operator precedence and associativity")
    void testOperatorTable() {
        assertEquals(Operator.AND, Operator.fromSymbol("AND"));
        assertEquals(Operator.AND, Operator.fromSymbol("&&"));
        assertEquals(Operator.OR, Operator.fromSymbol("OR"));
        assertEquals(Operator.NOT, Operator.fromSymbol("NOT"));
        assertEquals(Associativity.RIGHT, Operator.POWER.associativity());
        assertEquals(Associativity.LEFT, Operator.DIVIDE.associativity());
        assertTrue(Operator.POWER.precedence() > Operator.MULTIPLY.precedence());
        assertTrue(Operator.MULTIPLY.precedence() > Operator.ADD.precedence());
        assertTrue(Operator.ADD.precedence() > Operator.LESS.precedence());
        assertTrue(Operator.LESS.precedence() > Operator.AND.precedence());
    }

    @Test
    @DisplayName("Unknown operator symbol")
    void testUnknownOperator() {
        UnknownOperatorException e = assertThrows(UnknownOperatorException.class, () -> Operator.fromSymbol("%"));
        assertEquals("%", e.getOperator());
    }
}
