package com.fnparser.ast;

public record ProjectionExpression(
    int start,
    int end,
    Expression object,
    Identifier property
) implements Expression {
    @Override
    public String type() {
        return "ProjectionExpression";
    }
}
