package org.finos.legend.math.lexer;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Token Tests")
class TokenTest {

    private static Token token(TokenType type, String value) {
        return Token.of(type, value);
    }

    @Test
    @DisplayName("Synthetic tokens have no position and match their value")
    void testSyntheticToken() {
        Token star = Token.of(TokenType.MULTIPLICATION_OPERATOR, "*");

        assertEquals(-1, star.position());
        assertEquals("*", star.match());
        assertEquals(1, star.length());
    }

    @Test
    @DisplayName("Operand followed by operand is an implicit product")
    void testEligiblePairs() {
        assertTrue(Token.canFactorsInImplicitMultiplication(
                token(TokenType.NATURAL_NUMBER, "2"), token(TokenType.VARIABLE, "x")));
        assertTrue(Token.canFactorsInImplicitMultiplication(
                token(TokenType.CLOSE_PARENTHESIS, ")"), token(TokenType.OPEN_PARENTHESIS, "(")));
        assertTrue(Token.canFactorsInImplicitMultiplication(
                token(TokenType.FACTORIAL_OPERATOR, "!"), token(TokenType.CONSTANT, "pi")));
        assertTrue(Token.canFactorsInImplicitMultiplication(
                token(TokenType.VARIABLE, "x"), token(TokenType.FUNCTION_NAME, "sin")));
    }

    @Test
    @DisplayName("Function call, operators and missing tokens are never products")
    void testIneligiblePairs() {
        assertFalse(Token.canFactorsInImplicitMultiplication(
                token(TokenType.FUNCTION_NAME, "sin"), token(TokenType.OPEN_PARENTHESIS, "(")));
        assertFalse(Token.canFactorsInImplicitMultiplication(
                token(TokenType.NATURAL_NUMBER, "2"), token(TokenType.ADDITION_OPERATOR, "+")));
        assertFalse(Token.canFactorsInImplicitMultiplication(
                token(TokenType.OPEN_PARENTHESIS, "("), token(TokenType.VARIABLE, "x")));
        assertFalse(Token.canFactorsInImplicitMultiplication(
                token(TokenType.VARIABLE, "x"), token(TokenType.CLOSE_PARENTHESIS, ")")));
        assertFalse(Token.canFactorsInImplicitMultiplication(null, token(TokenType.VARIABLE, "x")));
        assertFalse(Token.canFactorsInImplicitMultiplication(token(TokenType.VARIABLE, "x"), null));
    }

    @Test
    @DisplayName("Token definitions only match at the given offset")
    void testDefinitionAnchored() {
        TokenDefinition natural = TokenDefinition.of("\\d+", TokenType.NATURAL_NUMBER);

        assertTrue(natural.match("x12", 0).isEmpty());
        Token token = natural.match("x12", 1).orElseThrow();
        assertEquals("12", token.value());
        assertEquals(1, token.position());
    }

    @Test
    @DisplayName("Empty matches do not count")
    void testEmptyMatch() {
        TokenDefinition optionalDigits = TokenDefinition.of("\\d*", TokenType.NATURAL_NUMBER);

        assertTrue(optionalDigits.match("abc", 0).isEmpty());
    }
}
