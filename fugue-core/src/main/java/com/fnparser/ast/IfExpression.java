package com.fnparser.ast;

public record IfExpression(
    int start,
    int end,
    Expression test,
    Expression consequent,
    Expression alternate
) implements Expression {
    @Override
    public String type() {
        return "IfExpression";
    }
}
