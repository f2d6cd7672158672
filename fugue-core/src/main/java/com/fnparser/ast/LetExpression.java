package com.fnparser.ast;

import java.util.List;

public record LetExpression(
    int start,
    int end,
    List<ValueBinding> bindings,
    Expression body
) implements Expression {
    @Override
    public String type() {
        return "LetExpression";
    }
}
