package org.finos.legend.math.lexer;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A lexical unit.
 *
 * @param type     The token type
 * @param value    The canonical value; synonyms such as asin and arcsin share one value
 * @param match    The text actually matched in the input, used to advance the cursor
 * @param position The offset in the source string, or -1 for synthetic tokens
 */
public record Token(TokenType type, String value, String match, int position) {

    private static final Set<TokenType> LEFT_FACTORS = EnumSet.of(
            TokenType.NATURAL_NUMBER, TokenType.INTEGER, TokenType.REAL_NUMBER, TokenType.CONSTANT,
            TokenType.VARIABLE, TokenType.FUNCTION_NAME, TokenType.CLOSE_PARENTHESIS,
            TokenType.FACTORIAL_OPERATOR, TokenType.SEMI_FACTORIAL_OPERATOR);

    private static final Set<TokenType> RIGHT_FACTORS = EnumSet.of(
            TokenType.NATURAL_NUMBER, TokenType.INTEGER, TokenType.REAL_NUMBER, TokenType.CONSTANT,
            TokenType.VARIABLE, TokenType.FUNCTION_NAME, TokenType.OPEN_PARENTHESIS);

    public Token {
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        if (match == null || match.isEmpty()) {
            match = value;
        }
    }

    /**
     * Creates a synthetic token whose matched text is its value.
     */
    public static Token of(TokenType type, String value) {
        return new Token(type, value, value, -1);
    }

    public int length() {
        return match.length();
    }

    /**
     * Determines whether two adjacent tokens form an implicit multiplication, as in "2x" or "(a)(b)".
     * The first token must end an operand and the second must start one; a function name followed by
     * an opening parenthesis is a call, never a product.
     */
    public static boolean canFactorsInImplicitMultiplication(Token first, Token second) {
        if (first == null || second == null) {
            return false;
        }
        if (first.type == TokenType.FUNCTION_NAME && second.type == TokenType.OPEN_PARENTHESIS) {
            return false;
        }
        return LEFT_FACTORS.contains(first.type) && RIGHT_FACTORS.contains(second.type);
    }

    @Override
    public String toString() {
        return type + "(" + value + ")" + (position >= 0 ? "@" + position : "");
    }
}
