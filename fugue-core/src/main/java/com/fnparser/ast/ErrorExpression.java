package com.fnparser.ast;

/**
 * Placeholder for source that failed to parse. Only appears in partial trees.
 */
public record ErrorExpression(
    int start,
    int end
) implements Expression {
    @Override
    public String type() {
        return "ErrorExpression";
    }
}
