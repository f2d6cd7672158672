package com.fnparser.ast;

import java.util.List;

public record TupleExpression(
    int start,
    int end,
    List<Expression> elements
) implements Expression {
    @Override
    public String type() {
        return "TupleExpression";
    }
}
