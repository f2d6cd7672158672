package com.fnparser.ast;

public record InfixExpression(
    int start,
    int end,
    Expression left,
    Identifier operator,  // operator-shaped name, e.g. "+" or "<|"
    Expression right
) implements Expression {
    @Override
    public String type() {
        return "InfixExpression";
    }
}
