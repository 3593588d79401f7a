package org.finos.legend.math.parser;

import org.finos.legend.math.lexer.Token;

import java.util.List;

/**
 * Snapshot of the parser stacks after consuming one token, bottom of each stack first.
 */
public record ParseStep(Token token, List<String> operands, List<String> operators) {

    public ParseStep {
        operands = List.copyOf(operands);
        operators = List.copyOf(operators);
    }
}
