package org.finos.legend.math.lexer;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;

import java.util.regex.Pattern;

import static org.finos.legend.math.lexer.TokenDefinition.of;

/**
 * The lexer configurations of the four expression languages.
 *
 * Order matters: longer patterns go first so that a shorter synonym never steals a prefix.
 */
public final class Lexers {

    private Lexers() {
    }

    private static final ImmutableList<TokenDefinition> NUMBERS = Lists.immutable.of(
            of("\\d+\\.\\d+(e[+-]?\\d+)?", TokenType.REAL_NUMBER),
            of("\\d+", TokenType.NATURAL_NUMBER),
            of("\\d*(\\.\\d\\d)", TokenType.STRING));

    private static final ImmutableList<TokenDefinition> ROUNDING_FUNCTIONS = Lists.immutable.of(
            of("round", TokenType.FUNCTION_NAME),
            of("ceil", TokenType.FUNCTION_NAME),
            of("floor", TokenType.FUNCTION_NAME),
            of("ending", TokenType.FUNCTION_NAME));

    private static final ImmutableList<TokenDefinition> MATH_FUNCTIONS = Lists.immutable.of(
            of("sqrt", TokenType.FUNCTION_NAME),
            of("sind", TokenType.FUNCTION_NAME),
            of("cosd", TokenType.FUNCTION_NAME),
            of("tand", TokenType.FUNCTION_NAME),
            of("cotd", TokenType.FUNCTION_NAME),
            of("sinh", TokenType.FUNCTION_NAME),
            of("cosh", TokenType.FUNCTION_NAME),
            of("tanh", TokenType.FUNCTION_NAME),
            of("coth", TokenType.FUNCTION_NAME),
            of("sin", TokenType.FUNCTION_NAME),
            of("cos", TokenType.FUNCTION_NAME),
            of("tan", TokenType.FUNCTION_NAME),
            of("cot", TokenType.FUNCTION_NAME),
            of("arsinh|arcsinh|asinh", TokenType.FUNCTION_NAME, "arsinh"),
            of("arcosh|arccosh|acosh", TokenType.FUNCTION_NAME, "arcosh"),
            of("artanh|arctanh|atanh", TokenType.FUNCTION_NAME, "artanh"),
            of("arcoth|arccoth|acoth", TokenType.FUNCTION_NAME, "arcoth"),
            of("arcsin|asin", TokenType.FUNCTION_NAME, "arcsin"),
            of("arccos|acos", TokenType.FUNCTION_NAME, "arccos"),
            of("arctan|atan", TokenType.FUNCTION_NAME, "arctan"),
            of("arccot|acot", TokenType.FUNCTION_NAME, "arccot"),
            of("exp", TokenType.FUNCTION_NAME),
            of("log10|lg", TokenType.FUNCTION_NAME, "lg"),
            of("log", TokenType.FUNCTION_NAME),
            of("ln", TokenType.FUNCTION_NAME),
            of("abs", TokenType.FUNCTION_NAME),
            of("sgn", TokenType.FUNCTION_NAME));

    private static final ImmutableList<TokenDefinition> DELIMITERS = Lists.immutable.of(
            of("\\(", TokenType.OPEN_PARENTHESIS),
            of("\\)", TokenType.CLOSE_PARENTHESIS),
            of("\\{", TokenType.OPEN_BRACE),
            of("\\}", TokenType.CLOSE_BRACE));

    private static final ImmutableList<TokenDefinition> ARITHMETIC = Lists.immutable.of(
            of("\\+", TokenType.ADDITION_OPERATOR),
            of("\\-", TokenType.SUBTRACTION_OPERATOR),
            of("\\*", TokenType.MULTIPLICATION_OPERATOR),
            of("/", TokenType.DIVISION_OPERATOR),
            of("\\^", TokenType.EXPONENTIAL_OPERATOR));

    private static final ImmutableList<TokenDefinition> POSTFIX = Lists.immutable.of(
            of("!!", TokenType.SEMI_FACTORIAL_OPERATOR),
            of("!", TokenType.FACTORIAL_OPERATOR));

    private static final ImmutableList<TokenDefinition> NUMERIC_CONSTANTS = Lists.immutable.of(
            of("NAN", TokenType.CONSTANT),
            of("INF", TokenType.CONSTANT),
            of("pi", TokenType.CONSTANT));

    private static final ImmutableList<TokenDefinition> SEPARATORS = Lists.immutable.of(
            of(",", TokenType.TERMINATOR),
            of(";", TokenType.TERMINATOR),
            of("\\n", TokenType.TERMINATOR),
            of("\\s+", TokenType.WHITESPACE));

    private static final ImmutableList<TokenDefinition> CONDITIONALS = Lists.immutable.of(
            of("IF|if", TokenType.IF, "IF"),
            of("THEN", TokenType.THEN),
            of("ELSE|else", TokenType.ELSE, "ELSE"),
            of("return", TokenType.RETURN));

    private static final ImmutableList<TokenDefinition> RELATIONS = Lists.immutable.of(
            of("=", TokenType.EQUAL_TO),
            of("<>", TokenType.DIFFERENT_THAN),
            of(">=", TokenType.GREATER_OR_EQUAL_THAN),
            of("<=", TokenType.LESS_OR_EQUAL_THAN),
            of(">", TokenType.GREATER_THAN),
            of("<", TokenType.LESS_THAN));

    private static final ImmutableList<TokenDefinition> CONNECTIVES = Lists.immutable.of(
            of("&&", TokenType.AND),
            of("\\|\\|", TokenType.OR),
            of("AND", TokenType.AND, "&&"),
            of("OR", TokenType.OR, "||"));

    private static final ImmutableList<TokenDefinition> BOOLEANS = Lists.immutable.of(
            of("TRUE|true", TokenType.BOOLEAN, "TRUE"),
            of("FALSE|false", TokenType.BOOLEAN, "FALSE"));

    private static final TokenDefinition WORD_VARIABLE = of("\\$?[a-zA-Z_][a-zA-Z0-9_]*", TokenType.VARIABLE);
    private static final TokenDefinition LETTER_VARIABLE = of("[a-zA-Z]", TokenType.VARIABLE);

    /**
     * Real-valued math: numbers, the full function table, constants pi, e, NAN, INF and single-letter variables.
     */
    public static Lexer stdMath() {
        MutableList<TokenDefinition> definitions = base();
        definitions.add(of("e", TokenType.CONSTANT));
        definitions.add(LETTER_VARIABLE);
        return new Lexer(definitions);
    }

    /**
     * Complex math: the real configuration plus arg, conj, re, im and the imaginary unit.
     */
    public static Lexer complexMath() {
        MutableList<TokenDefinition> definitions = base();
        definitions.add(of("arg", TokenType.FUNCTION_NAME));
        definitions.add(of("conj", TokenType.FUNCTION_NAME));
        definitions.add(of("re", TokenType.FUNCTION_NAME));
        definitions.add(of("im", TokenType.FUNCTION_NAME));
        definitions.add(of("i", TokenType.CONSTANT));
        definitions.add(of("e", TokenType.CONSTANT));
        definitions.add(LETTER_VARIABLE);
        return new Lexer(definitions);
    }

    /**
     * Boolean logic and conditionals on top of real math, with named variables.
     */
    public static Lexer logic() {
        MutableList<TokenDefinition> definitions = Lists.mutable.empty();
        definitions.addAll(CONDITIONALS.collect(Lexers::word).castToList());
        definitions.addAll(BOOLEANS.collect(Lexers::word).castToList());
        definitions.addAll(CONNECTIVES.collect(Lexers::word).castToList());
        definitions.add(word(of("NOT", TokenType.NOT)));
        definitions.addAll(base().collect(Lexers::word));
        definitions.addAll(RELATIONS.castToList());
        definitions.add(word(of("e", TokenType.CONSTANT)));
        definitions.add(WORD_VARIABLE);
        return new Lexer(definitions);
    }

    /**
     * The pricing language: arithmetic, rounding, ending(), conditionals and named variables.
     */
    public static Lexer pricing() {
        MutableList<TokenDefinition> definitions = Lists.mutable.empty();
        definitions.addAll(CONDITIONALS.collect(Lexers::word).castToList());
        definitions.addAll(BOOLEANS.collect(Lexers::word).castToList());
        definitions.addAll(CONNECTIVES.collect(Lexers::word).castToList());
        definitions.add(word(of("NOT", TokenType.NOT)));
        definitions.add(of("!", TokenType.NOT, "NOT"));
        definitions.addAll(NUMBERS.castToList());
        definitions.addAll(ROUNDING_FUNCTIONS.collect(Lexers::word).castToList());
        definitions.addAll(DELIMITERS.castToList());
        definitions.addAll(ARITHMETIC.castToList());
        definitions.addAll(RELATIONS.castToList());
        definitions.addAll(SEPARATORS.castToList());
        definitions.add(WORD_VARIABLE);
        return new Lexer(definitions);
    }

    /**
     * Restricts an alphabetic definition to whole words, so that a named variable such as "cost" is not
     * split into the function "cos" and the variable "t". Symbolic definitions are returned unchanged.
     */
    static TokenDefinition word(TokenDefinition definition) {
        String regex = definition.pattern().pattern();
        if (!Character.isLetter(regex.charAt(0))) {
            return definition;
        }
        return new TokenDefinition(Pattern.compile("(?:" + regex + ")(?![a-zA-Z0-9_])"),
                definition.type(), definition.canonicalValue());
    }

    private static MutableList<TokenDefinition> base() {
        MutableList<TokenDefinition> definitions = Lists.mutable.empty();
        definitions.addAll(NUMBERS.castToList());
        definitions.addAll(ROUNDING_FUNCTIONS.castToList());
        definitions.addAll(MATH_FUNCTIONS.castToList());
        definitions.addAll(DELIMITERS.castToList());
        definitions.addAll(ARITHMETIC.castToList());
        definitions.addAll(POSTFIX.castToList());
        definitions.addAll(NUMERIC_CONSTANTS.castToList());
        definitions.addAll(SEPARATORS.castToList());
        return definitions;
    }
}
