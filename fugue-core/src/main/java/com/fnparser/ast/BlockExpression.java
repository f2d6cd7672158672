package com.fnparser.ast;

import java.util.List;

public record BlockExpression(
    int start,
    int end,
    List<Expression> body
) implements Expression {
    @Override
    public String type() {
        return "BlockExpression";
    }
}
