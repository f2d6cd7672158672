package com.fnparser.ast;

/**
 * {@code do pattern = bound} followed by the rest of the block. {@code binding} is null for a
 * bare {@code seq}-style statement.
 */
public record DoExpression(
    int start,
    int end,
    Pattern binding,
    Expression bound,
    Expression body
) implements Expression {
    @Override
    public String type() {
        return "DoExpression";
    }
}
