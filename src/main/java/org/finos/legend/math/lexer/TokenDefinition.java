package org.finos.legend.math.lexer;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A pattern recognizing one kind of token.
 *
 * @param pattern        The regular expression; it must match at the current offset to count
 * @param type           The type of the produced token
 * @param canonicalValue Value shared by all synonyms matched by the pattern, or null to use the matched text
 */
public record TokenDefinition(Pattern pattern, TokenType type, String canonicalValue) {

    public TokenDefinition {
        Objects.requireNonNull(pattern, "Pattern cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
    }

    public static TokenDefinition of(String regex, TokenType type) {
        return new TokenDefinition(Pattern.compile(regex), type, null);
    }

    public static TokenDefinition of(String regex, TokenType type, String canonicalValue) {
        return new TokenDefinition(Pattern.compile(regex), type, canonicalValue);
    }

    /**
     * Tries to match the input starting exactly at {@code offset}.
     *
     * @return The matched token, or empty when the pattern does not match there (an empty match counts as none)
     */
    public Optional<Token> match(String input, int offset) {
        Matcher matcher = pattern.matcher(input);
        matcher.region(offset, input.length());
        if (!matcher.lookingAt() || matcher.end() == offset) {
            return Optional.empty();
        }
        String matched = matcher.group();
        String value = canonicalValue != null ? canonicalValue : matched;
        return Optional.of(new Token(type, value, matched, offset));
    }
}
