package org.finos.legend.math.error;

/**
 * Thrown when no token definition matches the remaining input.
 */
public class UnknownTokenException extends MathExpressionException {

    private final String character;
    private final int position;

    public UnknownTokenException(String character, int position) {
        super("Unknown token '" + character + "' at position " + position);
        this.character = character;
        this.position = position;
    }

    public String getCharacter() {
        return character;
    }

    public int getPosition() {
        return position;
    }
}
