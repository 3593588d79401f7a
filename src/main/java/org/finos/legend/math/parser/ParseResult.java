package org.finos.legend.math.parser;

import org.finos.legend.math.ast.Node;

import java.util.List;

/**
 * The parsed tree together with the recorded steps (empty unless debugging is enabled).
 */
public record ParseResult(Node root, List<ParseStep> steps) {

    public ParseResult {
        steps = List.copyOf(steps);
    }
}
