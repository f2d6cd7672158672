package com.fnparser.ast;

import java.util.List;

public record Application(
    int start,
    int end,
    Expression function,
    List<Expression> arguments
) implements Expression {
    @Override
    public String type() {
        return "Application";
    }
}
