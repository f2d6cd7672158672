package com.fnparser.ast;

import java.util.List;

public record LambdaExpression(
    int start,
    int end,
    List<Identifier> parameters,
    Expression body
) implements Expression {
    @Override
    public String type() {
        return "LambdaExpression";
    }
}
