package com.fnparser.ast;

import java.util.List;

public record TypeExpression(
    int start,
    int end,
    List<TypeBinding> bindings,
    Expression body
) implements Expression {
    @Override
    public String type() {
        return "TypeExpression";
    }
}
