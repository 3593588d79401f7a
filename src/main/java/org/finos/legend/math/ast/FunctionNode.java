package org.finos.legend.math.ast;

import org.finos.legend.math.error.SyntaxErrorException;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A call of a named function, including the postfix factorials "!" and "!!".
 *
 * @param name      The canonical function name
 * @param arguments The arguments, as many as {@link #arity(String)} requires
 */
public record FunctionNode(String name, List<Node> arguments) implements Node {

    public FunctionNode {
        Objects.requireNonNull(name, "Function name cannot be null");
        arguments = List.copyOf(arguments);
        if (arguments.size() != arity(name)) {
            throw new SyntaxErrorException("Function '" + name + "' expects " + arity(name)
                    + " argument(s), got " + arguments.size());
        }
    }

    public static FunctionNode of(String name, Node... arguments) {
        return new FunctionNode(name, List.of(arguments));
    }

    public static int arity(String name) {
        return "ending".equals(name) ? 2 : 1;
    }

    public int arity() {
        return arity(name);
    }

    public Node argument() {
        return arguments.get(0);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public String toString() {
        return name + arguments.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
