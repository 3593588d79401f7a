package org.finos.legend.math.lexer;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.finos.legend.math.error.UnknownTokenException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts an expression string into a list of tokens.
 *
 * Definitions are tried in registration order and the first one matching at the current offset wins,
 * so longer operators and synonyms must be registered ahead of their prefixes ("!!" before "!",
 * "arcsinh" before "arcsin"). Whitespace and terminators are emitted as tokens; the parser decides
 * what to do with them.
 *
 * A lexer holds only its immutable definition list and can be shared between threads.
 */
public final class Lexer {

    private final ImmutableList<TokenDefinition> definitions;

    public Lexer(List<TokenDefinition> definitions) {
        this.definitions = Lists.immutable.withAll(definitions);
    }

    public ImmutableList<TokenDefinition> getDefinitions() {
        return definitions;
    }

    /**
     * Tokenizes the entire input string.
     *
     * @param input The expression text
     * @return List of tokens in input order
     * @throws UnknownTokenException if no definition matches at some offset
     */
    public List<Token> tokenize(String input) {
        List<Token> tokens = new ArrayList<>();
        int position = 0;

        while (position < input.length()) {
            Token token = nextToken(input, position)
                    .orElseThrow(() -> unknownToken(input, tokens));
            tokens.add(token);
            position += token.length();
        }

        return tokens;
    }

    private Optional<Token> nextToken(String input, int position) {
        for (TokenDefinition definition : definitions) {
            Optional<Token> token = definition.match(input, position);
            if (token.isPresent()) {
                return token;
            }
        }
        return Optional.empty();
    }

    private static UnknownTokenException unknownToken(String input, List<Token> consumed) {
        int position = consumed.stream().mapToInt(Token::length).sum();
        return new UnknownTokenException(Character.toString(input.codePointAt(position)), position);
    }
}
