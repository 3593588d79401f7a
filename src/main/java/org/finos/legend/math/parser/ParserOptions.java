package org.finos.legend.math.parser;

/**
 * Parser configuration.
 *
 * @param allowImplicitMultiplication Insert "*" between adjacent factors, as in "2x" or "(a)(b)"
 * @param simplify                    Fold constant sub-expressions while building the tree
 * @param debug                       Record and log the operand and operator stacks after every token
 */
public record ParserOptions(boolean allowImplicitMultiplication, boolean simplify, boolean debug) {

    public static final String IMPLICIT_MULTIPLICATION_PROPERTY = "legend.math.implicitMultiplication";
    public static final String SIMPLIFY_PROPERTY = "legend.math.simplify";
    public static final String DEBUG_PROPERTY = "legend.math.debug";

    public static ParserOptions defaults() {
        return new ParserOptions(true, true, false);
    }

    /**
     * Reads the options from system properties, falling back to {@link #defaults()} for unset keys.
     */
    public static ParserOptions fromSystemProperties() {
        ParserOptions defaults = defaults();
        return new ParserOptions(
                flag(IMPLICIT_MULTIPLICATION_PROPERTY, defaults.allowImplicitMultiplication()),
                flag(SIMPLIFY_PROPERTY, defaults.simplify()),
                flag(DEBUG_PROPERTY, defaults.debug()));
    }

    private static boolean flag(String key, boolean fallback) {
        String value = System.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public ParserOptions withImplicitMultiplication(boolean allow) {
        return new ParserOptions(allow, simplify, debug);
    }

    public ParserOptions withSimplify(boolean enabled) {
        return new ParserOptions(allowImplicitMultiplication, enabled, debug);
    }

    public ParserOptions withDebug(boolean enabled) {
        return new ParserOptions(allowImplicitMultiplication, simplify, enabled);
    }
}
